package io.privx.sdk.oauth;

import io.privx.sdk.config.PrivxConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * CDI producer for the application's {@link ClientCredential}.
 *
 * <p>Sources, lowest precedence first:
 * <ol>
 *   <li>the TOML file named by {@code privx.config-file}</li>
 *   <li>the {@code PRIVX_API_*} environment variables</li>
 *   <li>explicit {@code privx.api-client-*} and {@code privx.oauth-client-*} properties</li>
 * </ol>
 */
@ApplicationScoped
public class CredentialProducer {

    private static final Logger LOG = Logger.getLogger(CredentialProducer.class);

    private final PrivxConfig config;
    private final ConfigFileReader fileReader;
    private final Environment environment;

    @Inject
    public CredentialProducer(PrivxConfig config) {
        this(config, ConfigFileReader.FILE_SYSTEM, Environment.SYSTEM);
    }

    CredentialProducer(PrivxConfig config, ConfigFileReader fileReader, Environment environment) {
        this.config = config;
        this.fileReader = fileReader;
        this.environment = environment;
    }

    @Produces
    @Singleton
    public ClientCredential clientCredential() {
        ClientCredential credential = CredentialResolver.resolve(options());
        LOG.debugf("Resolved API client credential for access key '%s' (digest: %s)",
            credential.getAccess(), credential.hasDigest());
        return credential;
    }

    List<CredentialOption> options() {
        return List.of(
            CredentialOptions.fromConfigFile(config.configFile().orElse(null), fileReader),
            CredentialOptions.fromEnvironment(environment),
            CredentialOptions.access(config.apiClientId().orElse(null)),
            CredentialOptions.secret(config.apiClientSecret().orElse(null)),
            CredentialOptions.digest(config.oauthClientId().orElse(null), config.oauthClientSecret().orElse(null))
        );
    }
}
