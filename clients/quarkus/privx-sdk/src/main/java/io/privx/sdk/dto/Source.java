package io.privx.sdk.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A user directory source feeding the role store.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Source(
    String id,
    String name,
    String comment,
    Boolean enabled,
    Integer ttl,
    List<String> tags
) {}
