package io.privx.sdk.client.auth;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.privx.sdk.config.PrivxConfig;
import io.privx.sdk.exception.AuthenticationException;
import io.privx.sdk.oauth.ClientCredential;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Manages OAuth access tokens for PrivX API authentication.
 *
 * <p>Tokens are obtained with the password grant: the API client ID and secret are sent
 * as username and password, and the credential digest, when present, authenticates the
 * OAuth client with HTTP basic auth.
 */
@ApplicationScoped
public class AccessTokenManager {

    private static final Logger LOG = Logger.getLogger(AccessTokenManager.class);

    static final String DEFAULT_TOKEN_PATH = "/auth/api/v1/oauth/token";

    private final PrivxConfig config;
    private final ClientCredential credential;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    private String accessToken;
    private Instant expiresAt;

    @Inject
    public AccessTokenManager(PrivxConfig config, ClientCredential credential) {
        this.config = config;
        this.credential = credential;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Get a valid access token, fetching a new one if necessary.
     */
    public String getAccessToken() {
        lock.lock();
        try {
            if (isTokenValid()) {
                return accessToken;
            }
            return fetchNewToken();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Force refresh the access token.
     */
    public String refreshToken() {
        lock.lock();
        try {
            return fetchNewToken();
        } finally {
            lock.unlock();
        }
    }

    private boolean isTokenValid() {
        return accessToken != null
            && expiresAt != null
            && Instant.now().plusSeconds(30).isBefore(expiresAt);
    }

    private String fetchNewToken() {
        if (credential.getAccess().isEmpty() || credential.getSecret().isEmpty()) {
            throw AuthenticationException.missingCredentials();
        }

        String tokenUrl = config.tokenUrl()
            .orElseGet(() -> config.baseUrl().replaceAll("/$", "") + DEFAULT_TOKEN_PATH);

        String body = "grant_type=password"
            + "&username=" + URLEncoder.encode(credential.getAccess(), StandardCharsets.UTF_8)
            + "&password=" + URLEncoder.encode(credential.getSecret(), StandardCharsets.UTF_8);

        try {
            HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(tokenUrl))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .timeout(Duration.ofSeconds(config.http().timeout()));
            if (credential.hasDigest()) {
                request.header("Authorization", "Basic " + credential.getDigest());
            }

            HttpResponse<String> response = httpClient.send(
                request.build(), HttpResponse.BodyHandlers.ofString()
            );

            if (response.statusCode() != 200) {
                LOG.warnf("Token request for %s rejected with status %d", credential.getAccess(), response.statusCode());
                throw AuthenticationException.invalidCredentials();
            }

            Map<String, Object> json = objectMapper.readValue(
                response.body(), new TypeReference<Map<String, Object>>() {}
            );

            Object token = json.get("access_token");
            if (token == null) {
                throw new AuthenticationException("Token response has no access_token");
            }
            this.accessToken = token.toString();
            int expiresIn = ((Number) json.getOrDefault("expires_in", 3600)).intValue();
            this.expiresAt = Instant.now().plusSeconds(expiresIn);

            LOG.debugf("Obtained access token for %s, expires in %ds", credential.getAccess(), expiresIn);
            return this.accessToken;
        } catch (AuthenticationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationException("Interrupted while fetching access token", e);
        } catch (Exception e) {
            throw new AuthenticationException("Failed to fetch access token", e);
        }
    }
}
