package com.health.compliance.model;

import java.util.List;

/**
 * One page of a timestamp-descending listing. {@code nextCursor} is the timestamp to pass as
 * {@code before} for the next page.
 */
public record PagedResponse<T>(List<T> data, boolean hasMore, String nextCursor) {

    public static <T> PagedResponse<T> empty() {
        return new PagedResponse<>(List.of(), false, null);
    }
}
