package com.memory.graph.api;

import com.memory.graph.core.ValidationException;

/**
 * Offset-based pagination request over entities in creation order.
 */
public record PageRequest(int offset, int limit) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    public PageRequest {
        if (offset < 0) {
            throw new ValidationException("offset must be >= 0");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_LIMIT);
        }
    }

    /**
     * Builds a request from optional query parameters, applying the defaults.
     */
    public static PageRequest of(Integer offset, Integer limit) {
        return new PageRequest(offset != null ? offset : 0, limit != null ? limit : DEFAULT_LIMIT);
    }

    public static PageRequest first(int limit) {
        return new PageRequest(0, limit);
    }

    public PageRequest next() {
        return new PageRequest(offset + limit, limit);
    }
}
