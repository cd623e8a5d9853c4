package io.privx.sdk.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.tomakehurst.wiremock.WireMockServer;
import io.privx.sdk.client.auth.AccessTokenManager;
import io.privx.sdk.config.PrivxConfig;
import io.privx.sdk.dto.ListResult;
import io.privx.sdk.dto.Role;
import io.privx.sdk.exception.AuthenticationException;
import io.privx.sdk.exception.PrivxException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * HTTP-level tests for PrivxClient against a WireMock server.
 *
 * <ul>
 *   <li>Bearer token and JSON headers on every request</li>
 *   <li>Status codes mapped to exceptions</li>
 *   <li>Retry of GET and DELETE on server errors only</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class PrivxClientTest {

    private static final String ROLES_PATH = "/role-store/api/v1/users/u1/roles";

    @Mock
    private PrivxConfig config;

    @Mock
    private PrivxConfig.HttpConfig httpConfig;

    @Mock
    private AccessTokenManager tokenManager;

    private WireMockServer server;
    private PrivxClient client;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(options().dynamicPort());
        server.start();

        lenient().when(config.baseUrl()).thenReturn(server.baseUrl() + "/");
        lenient().when(config.http()).thenReturn(httpConfig);
        lenient().when(httpConfig.timeout()).thenReturn(5);
        lenient().when(httpConfig.retryAttempts()).thenReturn(3);
        lenient().when(httpConfig.retryDelay()).thenReturn(1);
        lenient().when(tokenManager.getAccessToken()).thenReturn("token-1");
        lenient().when(tokenManager.refreshToken()).thenReturn("token-2");

        client = new PrivxClient(config, tokenManager);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("get should send the bearer token and decode the body")
    void get_shouldSendBearerTokenAndDecode() {
        server.stubFor(get(urlEqualTo(ROLES_PATH))
            .willReturn(okJson("{\"count\":1,\"items\":[{\"id\":\"r1\",\"name\":\"admins\",\"explicit\":true,"
                + "\"access_group_id\":\"ag1\",\"unknown_field\":1}]}")));

        ListResult<Role> result = client.get(ROLES_PATH, new TypeReference<ListResult<Role>>() {});

        assertThat(result.count()).isEqualTo(1);
        assertThat(result.items()).singleElement().satisfies(role -> {
            assertThat(role.id()).isEqualTo("r1");
            assertThat(role.explicit()).isTrue();
            assertThat(role.accessGroupId()).isEqualTo("ag1");
        });
        server.verify(getRequestedFor(urlEqualTo(ROLES_PATH))
            .withHeader("Authorization", equalTo("Bearer token-1"))
            .withHeader("Accept", equalTo("application/json")));
    }

    @Test
    @DisplayName("put should send the body as JSON without null fields")
    void put_shouldSendJsonBody() {
        server.stubFor(put(urlEqualTo(ROLES_PATH)).willReturn(ok()));

        client.put(ROLES_PATH, List.of(Role.explicitGrant("r1")));

        server.verify(1, putRequestedFor(urlEqualTo(ROLES_PATH))
            .withHeader("Content-Type", equalTo("application/json"))
            .withRequestBody(equalToJson("[{\"id\":\"r1\",\"explicit\":true}]")));
    }

    @Test
    @DisplayName("post should return null when the response body is empty")
    void post_shouldReturnNull_whenBodyEmpty() {
        server.stubFor(post(urlEqualTo("/role-store/api/v1/roles/resolve")).willReturn(ok()));

        Object result = client.post("/role-store/api/v1/roles/resolve", List.of("admins"),
            new TypeReference<Map<String, Object>>() {});

        assertThat(result).isNull();
    }

    @Test
    @DisplayName("get should raise AuthenticationException on 401 without retrying")
    void get_shouldThrowAuthenticationException_when401() {
        server.stubFor(get(urlEqualTo(ROLES_PATH)).willReturn(unauthorized()));

        assertThatThrownBy(() -> client.get(ROLES_PATH, new TypeReference<Map<String, Object>>() {}))
            .isInstanceOf(AuthenticationException.class);

        server.verify(1, getRequestedFor(urlEqualTo(ROLES_PATH)));
    }

    @Test
    @DisplayName("get should expose the PrivX error message and status on 404")
    void get_shouldThrowWithErrorBody_when404() {
        server.stubFor(get(urlEqualTo("/role-store/api/v1/roles/ghost"))
            .willReturn(aResponse()
                .withStatus(404)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"error_code\":\"NOT_FOUND\",\"error_message\":\"role not found\"}")));

        assertThatThrownBy(() -> client.get("/role-store/api/v1/roles/ghost", new TypeReference<Role>() {}))
            .isInstanceOfSatisfying(PrivxException.class, e -> {
                assertThat(e.getStatusCode()).isEqualTo(404);
                assertThat(e.getMessage()).isEqualTo("role not found");
                assertThat(e.getErrorCode()).isEqualTo("NOT_FOUND");
            });

        server.verify(1, getRequestedFor(urlEqualTo("/role-store/api/v1/roles/ghost")));
    }

    @Test
    @DisplayName("get should fall back to a generic message when the error body is not JSON")
    void get_shouldUseGenericMessage_whenErrorBodyNotJson() {
        server.stubFor(get(urlEqualTo(ROLES_PATH)).willReturn(aResponse().withStatus(403).withBody("<html>denied</html>")));

        assertThatThrownBy(() -> client.get(ROLES_PATH, new TypeReference<Map<String, Object>>() {}))
            .isInstanceOf(PrivxException.class)
            .hasMessage("Access forbidden");
    }

    @Test
    @DisplayName("get should retry server errors with a refreshed token")
    void get_shouldRetryServerErrors() {
        server.stubFor(get(urlEqualTo(ROLES_PATH)).willReturn(serverError()));

        assertThatThrownBy(() -> client.get(ROLES_PATH, new TypeReference<Map<String, Object>>() {}))
            .isInstanceOfSatisfying(PrivxException.class, e -> assertThat(e.getStatusCode()).isEqualTo(500));

        server.verify(3, getRequestedFor(urlEqualTo(ROLES_PATH)));
        server.verify(2, getRequestedFor(urlEqualTo(ROLES_PATH)).withHeader("Authorization", equalTo("Bearer token-2")));
        verify(tokenManager, times(1)).getAccessToken();
        verify(tokenManager, times(2)).refreshToken();
    }

    @Test
    @DisplayName("post should not be retried on server errors")
    void post_shouldNotRetry() {
        server.stubFor(post(urlEqualTo("/role-store/api/v1/roles")).willReturn(serverError()));

        assertThatThrownBy(() -> client.post("/role-store/api/v1/roles", Map.of("name", "auditors"),
            new TypeReference<Map<String, Object>>() {}))
            .isInstanceOf(PrivxException.class);

        server.verify(1, postRequestedFor(urlEqualTo("/role-store/api/v1/roles")));
    }

    @Test
    @DisplayName("put should be sent once when the server fails")
    void put_shouldNotRetry_whenServerUnavailable() {
        server.stubFor(put(urlEqualTo(ROLES_PATH)).willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> client.put(ROLES_PATH, List.of(Role.explicitGrant("r1"))))
            .isInstanceOfSatisfying(PrivxException.class, e -> {
                assertThat(e.getStatusCode()).isEqualTo(503);
                assertThat(e.getErrorCode()).isNull();
            });

        server.verify(1, putRequestedFor(urlEqualTo(ROLES_PATH)));
        verify(tokenManager, never()).refreshToken();
    }

    @Test
    @DisplayName("delete should fail with status 0 when the server is unreachable")
    void delete_shouldWrapTransportFailure() {
        server.stop();

        assertThatThrownBy(() -> client.delete("/role-store/api/v1/sources/s1"))
            .isInstanceOfSatisfying(PrivxException.class, e -> assertThat(e.getStatusCode()).isZero())
            .hasMessageStartingWith("Request failed");
    }

    @Test
    @DisplayName("roleStore should return the same resource instance")
    void roleStore_shouldBeCached() {
        assertThat(client.roleStore()).isSameAs(client.roleStore());
    }
}
