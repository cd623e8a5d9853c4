package io.privx.sdk.rolestore;

import com.fasterxml.jackson.core.type.TypeReference;
import io.privx.sdk.client.RestConnector;
import io.privx.sdk.client.RestPaths;
import io.privx.sdk.dto.ListResult;
import io.privx.sdk.dto.Role;
import io.privx.sdk.dto.RoleRef;
import io.privx.sdk.dto.Source;
import io.privx.sdk.dto.User;

import java.util.List;

/**
 * Resource for the PrivX role store: sources, users and roles.
 */
public class RoleStore implements RoleDirectory {

    private static final String BASE = "/role-store/api/v1";

    private final RestConnector api;
    private final RoleReconciler reconciler;

    public RoleStore(RestConnector api) {
        this.api = api;
        this.reconciler = new RoleReconciler(this);
    }

    // Sources

    /**
     * List all sources.
     */
    public List<Source> sources() {
        return items(api.get(BASE + "/sources", new TypeReference<ListResult<Source>>() {}));
    }

    /**
     * Get a source by ID.
     */
    public Source source(String id) {
        return api.get(RestPaths.format(BASE + "/sources/%s", id), new TypeReference<Source>() {});
    }

    /**
     * Create a source, returning its ID.
     */
    public String createSource(Source source) {
        return id(api.post(BASE + "/sources", source, new TypeReference<IdResult>() {}));
    }

    /**
     * Delete a source.
     */
    public void deleteSource(String id) {
        api.delete(RestPaths.format(BASE + "/sources/%s", id));
    }

    // Users

    /**
     * Search users matching the keywords within a source.
     */
    public List<User> searchUsers(String keywords, String source) {
        var request = new SearchUsersRequest(keywords, source);
        return items(api.post(BASE + "/users/search", request, new TypeReference<ListResult<User>>() {}));
    }

    /**
     * Get a user by ID.
     */
    public User user(String id) {
        return api.get(RestPaths.format(BASE + "/users/%s", id), new TypeReference<User>() {});
    }

    @Override
    public List<Role> userRoles(String userId) {
        return items(api.get(RestPaths.format(BASE + "/users/%s/roles", userId),
            new TypeReference<ListResult<Role>>() {}));
    }

    @Override
    public void replaceUserRoles(String userId, List<Role> roles) {
        api.put(RestPaths.format(BASE + "/users/%s/roles", userId), roles);
    }

    /**
     * Grant a role to a user. Does nothing if the user already has it.
     *
     * @see RoleReconciler#addUserRole(String, String)
     */
    public void addUserRole(String userId, String roleId) {
        reconciler.addUserRole(userId, roleId);
    }

    /**
     * Revoke a role from a user. Does nothing if the user does not have it.
     *
     * @see RoleReconciler#removeUserRole(String, String)
     */
    public void removeUserRole(String userId, String roleId) {
        reconciler.removeUserRole(userId, roleId);
    }

    // Roles

    /**
     * List all roles.
     */
    public List<Role> roles() {
        return items(api.get(BASE + "/roles", new TypeReference<ListResult<Role>>() {}));
    }

    @Override
    public Role role(String roleId) {
        return api.get(RestPaths.format(BASE + "/roles/%s", roleId), new TypeReference<Role>() {});
    }

    /**
     * List the users holding a role.
     */
    public List<User> roleMembers(String roleId) {
        return items(api.get(RestPaths.format(BASE + "/roles/%s/members", roleId),
            new TypeReference<ListResult<User>>() {}));
    }

    /**
     * Create a role, returning its ID.
     */
    public String createRole(Role role) {
        return id(api.post(BASE + "/roles", role, new TypeReference<IdResult>() {}));
    }

    /**
     * Resolve role names to role references.
     *
     * <p>The result follows the server's order, which need not match {@code names}; match
     * on {@link RoleRef#name()} when order matters. No request is made for an empty list.
     */
    public List<RoleRef> resolveRoles(List<String> names) {
        if (names == null || names.isEmpty()) {
            return List.of();
        }
        return items(api.post(BASE + "/roles/resolve", names,
            new TypeReference<ListResult<RoleRef>>() {}));
    }

    private static <T> List<T> items(ListResult<T> result) {
        return result != null ? result.itemsOrEmpty() : List.of();
    }

    private static String id(IdResult result) {
        return result != null ? result.id() : null;
    }

    // Request/Response DTOs

    public record SearchUsersRequest(
        String keywords,
        String source
    ) {}

    public record IdResult(
        String id
    ) {}
}
