package io.privx.sdk.dto;

/**
 * Reference to a role, as returned when resolving role names.
 */
public record RoleRef(
    String id,
    String name
) {}
