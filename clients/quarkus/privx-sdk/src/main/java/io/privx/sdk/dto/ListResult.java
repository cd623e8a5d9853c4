package io.privx.sdk.dto;

import java.util.List;

/**
 * List envelope with items and total count.
 */
public record ListResult<T>(
    int count,
    List<T> items
) {
    /**
     * Items of the envelope, never {@code null}.
     */
    public List<T> itemsOrEmpty() {
        return items != null ? items : List.of();
    }
}
