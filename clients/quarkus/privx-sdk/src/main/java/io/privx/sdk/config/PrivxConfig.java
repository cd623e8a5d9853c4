package io.privx.sdk.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Configuration for the PrivX SDK.
 *
 * <p>Configure in application.properties:
 * <pre>
 * privx.base-url=https://privx.example.com
 * privx.config-file=/etc/privx/config.toml
 * privx.api-client-id=your_api_client_id
 * privx.api-client-secret=your_api_client_secret
 * privx.oauth-client-id=privx-external
 * privx.oauth-client-secret=your_oauth_client_secret
 * </pre>
 *
 * <p>Credentials may also come from the TOML file or from the {@code PRIVX_API_*}
 * environment variables, see {@link io.privx.sdk.oauth.CredentialProducer}.
 */
@ConfigMapping(prefix = "privx")
public interface PrivxConfig {

    /**
     * Base URL for the PrivX API.
     */
    @WithName("base-url")
    @WithDefault("https://localhost")
    String baseUrl();

    /**
     * OAuth token endpoint. Defaults to {base-url}/auth/api/v1/oauth/token.
     */
    @WithName("token-url")
    Optional<String> tokenUrl();

    /**
     * TOML file holding an [auth] section with API client credentials.
     */
    @WithName("config-file")
    Optional<String> configFile();

    /**
     * API client ID, used as the access key.
     */
    @WithName("api-client-id")
    Optional<String> apiClientId();

    /**
     * API client secret, used as the secret key.
     */
    @WithName("api-client-secret")
    Optional<String> apiClientSecret();

    @WithName("oauth-client-id")
    Optional<String> oauthClientId();

    @WithName("oauth-client-secret")
    Optional<String> oauthClientSecret();

    /**
     * HTTP client configuration.
     */
    HttpConfig http();

    interface HttpConfig {
        /**
         * Request timeout in seconds.
         */
        @WithDefault("30")
        int timeout();

        /**
         * Number of attempts for idempotent requests (GET, PUT, DELETE).
         */
        @WithName("retry-attempts")
        @WithDefault("3")
        int retryAttempts();

        /**
         * Delay between retries in milliseconds.
         */
        @WithName("retry-delay")
        @WithDefault("100")
        int retryDelay();
    }
}
