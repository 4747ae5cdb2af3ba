package com.memory.graph.api;

import java.util.List;

/**
 * A page of results from a paginated query.
 *
 * @param items  the content of this page
 * @param offset offset of the first item
 * @param limit  the requested page size
 * @param total  total number of items across all pages
 * @param <T>    the element type
 */
public record Page<T>(List<T> items, int offset, int limit, long total) {

    public Page {
        items = items != null ? List.copyOf(items) : List.of();
        if (total < 0) {
            throw new IllegalArgumentException("total must be >= 0");
        }
    }

    public boolean hasNext() {
        return (long) offset + items.size() < total;
    }

    public static <T> Page<T> empty(PageRequest request) {
        return new Page<>(List.of(), request.offset(), request.limit(), 0);
    }
}
