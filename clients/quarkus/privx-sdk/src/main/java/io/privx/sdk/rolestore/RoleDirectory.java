package io.privx.sdk.rolestore;

import io.privx.sdk.dto.Role;

import java.util.List;

/**
 * Remote operations {@link RoleReconciler} needs from the role store.
 */
public interface RoleDirectory {

    /**
     * Current roles of the user.
     */
    List<Role> userRoles(String userId);

    /**
     * Canonical record of the role; fails if the role does not exist.
     */
    Role role(String roleId);

    /**
     * Replaces the user's role list with {@code roles}.
     */
    void replaceUserRoles(String userId, List<Role> roles);
}
