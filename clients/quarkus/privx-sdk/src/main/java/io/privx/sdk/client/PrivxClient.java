package io.privx.sdk.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.privx.sdk.client.auth.AccessTokenManager;
import io.privx.sdk.config.PrivxConfig;
import io.privx.sdk.exception.AuthenticationException;
import io.privx.sdk.exception.PrivxException;
import io.privx.sdk.rolestore.RoleStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * HTTP connector for the PrivX REST API.
 *
 * <p>Authenticates every call with a bearer token from {@link AccessTokenManager} and maps
 * error statuses to {@link PrivxException}s.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Inject
 * PrivxClient client;
 *
 * client.roleStore().addUserRole(userId, roleId);
 * }</pre>
 */
@ApplicationScoped
public class PrivxClient implements RestConnector {

    private static final Logger LOG = Logger.getLogger(PrivxClient.class);

    private static final Set<String> RETRYABLE_METHODS = Set.of("GET", "DELETE");

    private final PrivxConfig config;
    private final AccessTokenManager tokenManager;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private RoleStore roleStore;

    @Inject
    public PrivxClient(PrivxConfig config, AccessTokenManager tokenManager) {
        this.config = config;
        this.tokenManager = tokenManager;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(config.http().timeout()))
            .build();
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Get the Role Store resource.
     */
    public RoleStore roleStore() {
        if (roleStore == null) {
            roleStore = new RoleStore(this);
        }
        return roleStore;
    }

    @Override
    public <T> T get(String path, TypeReference<T> responseType) {
        return request("GET", path, null, responseType);
    }

    @Override
    public <T> T post(String path, Object body, TypeReference<T> responseType) {
        return request("POST", path, body, responseType);
    }

    @Override
    public void put(String path, Object body) {
        request("PUT", path, body, null);
    }

    @Override
    public void delete(String path) {
        request("DELETE", path, null, null);
    }

    /**
     * Make an authenticated API request.
     *
     * <p>GET and DELETE are retried on transport failures and server errors; client
     * errors are not retried. POST and PUT are sent once.
     * A {@code null} response type discards the response body.
     */
    public <T> T request(String method, String path, Object body, TypeReference<T> responseType) {
        int maxAttempts = RETRYABLE_METHODS.contains(method)
            ? Math.max(1, config.http().retryAttempts())
            : 1;
        int attempts = 0;
        PrivxException lastException = null;

        while (attempts < maxAttempts) {
            try {
                return doRequest(method, path, body, responseType, attempts > 0);
            } catch (AuthenticationException e) {
                throw e;
            } catch (PrivxException e) {
                if (e.getStatusCode() >= 400 && e.getStatusCode() < 500) {
                    throw e;
                }
                lastException = e;
                attempts++;
                if (attempts < maxAttempts) {
                    LOG.debugf("%s %s failed (%s), attempt %d of %d", method, path, e.getMessage(), attempts, maxAttempts);
                    sleep(config.http().retryDelay() * attempts);
                }
            }
        }

        throw lastException != null ? lastException : new PrivxException("Request failed");
    }

    private <T> T doRequest(String method, String path, Object body,
                            TypeReference<T> responseType, boolean isRetry) {
        try {
            String token = isRetry ? tokenManager.refreshToken() : tokenManager.getAccessToken();

            String url = config.baseUrl().replaceAll("/$", "") + path;

            HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(config.http().timeout()));

            if (body != null) {
                String jsonBody = objectMapper.writeValueAsString(body);
                requestBuilder.method(method, HttpRequest.BodyPublishers.ofString(jsonBody));
            } else {
                requestBuilder.method(method, HttpRequest.BodyPublishers.noBody());
            }

            LOG.debugf("%s %s", method, path);
            HttpResponse<String> response = httpClient.send(
                requestBuilder.build(),
                HttpResponse.BodyHandlers.ofString()
            );

            return handleResponse(response, responseType);
        } catch (PrivxException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PrivxException("Request interrupted: " + method + " " + path, e);
        } catch (Exception e) {
            throw new PrivxException("Request failed: " + e.getMessage(), e);
        }
    }

    private <T> T handleResponse(HttpResponse<String> response, TypeReference<T> responseType) {
        int status = response.statusCode();
        String body = response.body();

        if (status == 401) {
            throw AuthenticationException.tokenExpired();
        }

        if (status >= 400) {
            Map<String, Object> data = errorBody(body);
            String fallback = status == 403 ? "Access forbidden"
                : status == 404 ? "Resource not found"
                : status >= 500 ? "Server error: " + status
                : "Client error: " + status;
            throw new PrivxException(errorMessage(data, fallback), status, null, data);
        }

        if (responseType == null || body == null || body.isBlank()) {
            return null;
        }

        try {
            return objectMapper.readValue(body, responseType);
        } catch (IOException e) {
            throw new PrivxException("Failed to parse response", e);
        }
    }

    private Map<String, Object> errorBody(String body) {
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            LOG.debugf("Error response is not a JSON object: %s", e.getMessage());
            return Map.of();
        }
    }

    private static String errorMessage(Map<String, Object> data, String fallback) {
        Object message = data.get("error_message");
        if (message == null) {
            message = data.get("error_code");
        }
        return message != null ? message.toString() : fallback;
    }

    private void sleep(int millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
