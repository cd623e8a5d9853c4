package io.privx.sdk.rolestore;

import io.privx.sdk.dto.Role;
import io.privx.sdk.exception.PrivxException;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Converges a user's role membership with at most one write per call.
 *
 * <p>Each operation reads the current roles, decides locally, and writes the full list
 * back only if it changed. Membership is keyed by role ID; the {@code explicit} flag is
 * not part of the key.
 *
 * <p>No version token accompanies the write, so two concurrent calls for the same user
 * can both read the same list and the later write drops the earlier change.
 */
public class RoleReconciler {

    private static final Logger LOG = Logger.getLogger(RoleReconciler.class);

    private final RoleDirectory directory;

    public RoleReconciler(RoleDirectory directory) {
        this.directory = directory;
    }

    /**
     * Grants {@code roleId} to the user as an explicit role. Does nothing if the user
     * already holds the role, explicitly or not.
     *
     * <p>Fails without writing when the user's roles or the role itself cannot be read.
     */
    public void addUserRole(String userId, String roleId) {
        List<Role> roles = directory.userRoles(userId);
        for (Role role : roles) {
            if (roleId.equals(role.id())) {
                LOG.debugf("User %s already has role %s", userId, roleId);
                return;
            }
        }

        Role role = directory.role(roleId);
        if (role == null || role.id() == null) {
            throw new PrivxException("Role lookup returned no role: " + roleId);
        }

        List<Role> updated = new ArrayList<>(roles);
        updated.add(Role.explicitGrant(role.id()));

        directory.replaceUserRoles(userId, updated);
        LOG.infof("Granted role %s to user %s", role.id(), userId);
    }

    /**
     * Removes every role with {@code roleId} from the user, however it was granted. Does
     * nothing if the user does not hold the role.
     */
    public void removeUserRole(String userId, String roleId) {
        List<Role> roles = directory.userRoles(userId);

        List<Role> updated = new ArrayList<>(roles.size());
        for (Role role : roles) {
            if (!roleId.equals(role.id())) {
                updated.add(role);
            }
        }
        if (updated.size() == roles.size()) {
            LOG.debugf("User %s does not have role %s", userId, roleId);
            return;
        }

        directory.replaceUserRoles(userId, updated);
        LOG.infof("Revoked role %s from user %s", roleId, userId);
    }
}
