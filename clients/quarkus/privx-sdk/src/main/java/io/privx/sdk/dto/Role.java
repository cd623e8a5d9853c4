package io.privx.sdk.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A role, either as defined in the role store or as held by a user.
 *
 * <p>When listed under a user, {@code explicit} marks a direct grant and {@code implicit}
 * a role obtained through source rules. Roles are identified by {@code id} alone.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Role(
    String id,
    String name,
    boolean explicit,
    Boolean implicit,
    Boolean system,
    String comment,
    List<String> permissions,
    @JsonProperty("access_group_id") String accessGroupId
) {
    /**
     * A direct grant of the role with the given ID, as sent back when replacing user roles.
     */
    public static Role explicitGrant(String id) {
        return new Role(id, null, true, null, null, null, null, null);
    }
}
