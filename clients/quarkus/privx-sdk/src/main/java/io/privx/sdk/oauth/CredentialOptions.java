package io.privx.sdk.oauth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import io.privx.sdk.exception.ConfigurationException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Factories for the {@link CredentialOption}s understood by {@link CredentialResolver}.
 *
 * <p>A {@code null} argument means "not supplied" and turns the option into a no-op, so
 * possibly-absent flag or property values can be passed straight through.
 */
public final class CredentialOptions {

    private static final Logger LOG = Logger.getLogger(CredentialOptions.class);

    public static final String ENV_API_CLIENT_ID = "PRIVX_API_CLIENT_ID";
    public static final String ENV_API_CLIENT_SECRET = "PRIVX_API_CLIENT_SECRET";
    public static final String ENV_OAUTH_CLIENT_ID = "PRIVX_API_OAUTH_CLIENT_ID";
    public static final String ENV_OAUTH_CLIENT_SECRET = "PRIVX_API_OAUTH_CLIENT_SECRET";

    static final String AUTH_SECTION = "auth";
    static final String KEY_OAUTH_CLIENT_ID = "oauth_client_id";
    static final String KEY_OAUTH_CLIENT_SECRET = "oauth_client_secret";
    static final String KEY_API_CLIENT_ID = "api_client_id";
    static final String KEY_API_CLIENT_SECRET = "api_client_secret";

    private static final TomlMapper TOML = new TomlMapper();

    private CredentialOptions() {
    }

    /**
     * Sets the access key when {@code access} is non-null.
     */
    public static CredentialOption access(String access) {
        return credential -> {
            if (access != null) {
                credential.setAccess(access);
            }
            return credential;
        };
    }

    /**
     * Sets the secret key when {@code secret} is non-null.
     */
    public static CredentialOption secret(String secret) {
        return credential -> {
            if (secret != null) {
                credential.setSecret(secret);
            }
            return credential;
        };
    }

    /**
     * Sets the digest to base64 of {@code oauthAccess:oauthSecret} when both are non-null.
     * Otherwise any previous digest is left as it was.
     */
    public static CredentialOption digest(String oauthAccess, String oauthSecret) {
        return credential -> {
            if (oauthAccess != null && oauthSecret != null) {
                credential.setDigest(encodeDigest(oauthAccess, oauthSecret));
            }
            return credential;
        };
    }

    /**
     * Reads credentials from the {@code [auth]} section of a TOML file on the file system.
     *
     * @see #fromConfigFile(String, ConfigFileReader)
     */
    public static CredentialOption fromConfigFile(String path) {
        return fromConfigFile(path, ConfigFileReader.FILE_SYSTEM);
    }

    /**
     * Reads credentials from the {@code [auth]} section of a TOML file.
     *
     * <p>A {@code null} path is a no-op. A file that cannot be read throws
     * {@link ConfigurationException} and aborts resolution: a caller that names a file
     * expects it to exist. A file that cannot be parsed is only logged and contributes
     * nothing, leaving the other options to supply the fields.
     *
     * <p>Non-empty {@code api_client_id} and {@code api_client_secret} set access and secret;
     * the digest is set only when {@code oauth_client_id} and {@code oauth_client_secret}
     * are both non-empty.
     */
    public static CredentialOption fromConfigFile(String path, ConfigFileReader reader) {
        return credential -> {
            if (path == null) {
                return credential;
            }

            byte[] data;
            try {
                data = reader.read(Path.of(path));
            } catch (IOException | InvalidPathException e) {
                throw ConfigurationException.unreadableFile(path, e);
            }

            Optional<AuthSection> section = parseAuthSection(path, data);
            if (section.isEmpty()) {
                return credential;
            }
            AuthSection auth = section.get();

            if (!auth.apiClientId().isEmpty()) {
                credential.setAccess(auth.apiClientId());
            }
            if (!auth.apiClientSecret().isEmpty()) {
                credential.setSecret(auth.apiClientSecret());
            }
            if (!auth.oauthClientId().isEmpty() && !auth.oauthClientSecret().isEmpty()) {
                credential = digest(auth.oauthClientId(), auth.oauthClientSecret()).apply(credential);
            }
            return credential;
        };
    }

    /**
     * Reads credentials from the process environment.
     *
     * @see #fromEnvironment(Environment)
     */
    public static CredentialOption fromEnvironment() {
        return fromEnvironment(Environment.SYSTEM);
    }

    /**
     * Reads {@value #ENV_API_CLIENT_ID} and {@value #ENV_API_CLIENT_SECRET} into access and
     * secret, and computes the digest when both {@value #ENV_OAUTH_CLIENT_ID} and
     * {@value #ENV_OAUTH_CLIENT_SECRET} are defined. A defined variable wins even when empty.
     */
    public static CredentialOption fromEnvironment(Environment environment) {
        return credential -> {
            environment.lookup(ENV_API_CLIENT_ID).ifPresent(credential::setAccess);
            environment.lookup(ENV_API_CLIENT_SECRET).ifPresent(credential::setSecret);

            Optional<String> oauthAccess = environment.lookup(ENV_OAUTH_CLIENT_ID);
            Optional<String> oauthSecret = environment.lookup(ENV_OAUTH_CLIENT_SECRET);
            if (oauthAccess.isPresent() && oauthSecret.isPresent()) {
                credential = digest(oauthAccess.get(), oauthSecret.get()).apply(credential);
            }
            return credential;
        };
    }

    static String encodeDigest(String oauthAccess, String oauthSecret) {
        byte[] pair = (oauthAccess + ":" + oauthSecret).getBytes(StandardCharsets.UTF_8);
        return Base64.getEncoder().encodeToString(pair);
    }

    private static Optional<AuthSection> parseAuthSection(String path, byte[] data) {
        JsonNode root;
        try {
            root = TOML.readTree(data);
        } catch (IOException e) {
            LOG.warnf("Ignoring malformed configuration file %s: %s", path, e.getMessage());
            return Optional.empty();
        }

        JsonNode auth = fieldIgnoreCase(root, AUTH_SECTION);
        if (auth == null) {
            return Optional.of(AuthSection.EMPTY);
        }
        if (!auth.isObject()) {
            LOG.warnf("Ignoring configuration file %s: '%s' is not a table", path, AUTH_SECTION);
            return Optional.empty();
        }

        try {
            return Optional.of(new AuthSection(
                text(auth, KEY_OAUTH_CLIENT_ID),
                text(auth, KEY_OAUTH_CLIENT_SECRET),
                text(auth, KEY_API_CLIENT_ID),
                text(auth, KEY_API_CLIENT_SECRET)
            ));
        } catch (IllegalArgumentException e) {
            LOG.warnf("Ignoring configuration file %s: %s", path, e.getMessage());
            return Optional.empty();
        }
    }

    private static String text(JsonNode section, String key) {
        JsonNode value = fieldIgnoreCase(section, key);
        if (value == null || value.isNull()) {
            return "";
        }
        if (!value.isTextual()) {
            throw new IllegalArgumentException("'" + key + "' must be a string");
        }
        return value.textValue();
    }

    private static JsonNode fieldIgnoreCase(JsonNode node, String name) {
        JsonNode exact = node.get(name);
        if (exact != null) {
            return exact;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().equalsIgnoreCase(name)) {
                return field.getValue();
            }
        }
        return null;
    }

    private record AuthSection(
        String oauthClientId,
        String oauthClientSecret,
        String apiClientId,
        String apiClientSecret
    ) {
        static final AuthSection EMPTY = new AuthSection("", "", "", "");
    }
}
