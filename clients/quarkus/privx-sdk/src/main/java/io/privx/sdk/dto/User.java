package io.privx.sdk.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A user known to the role store.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record User(
    String id,
    String principal,
    String source,
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("full_name") String fullName,
    String email,
    List<Role> roles
) {}
