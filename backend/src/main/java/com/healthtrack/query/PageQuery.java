package com.healthtrack.query;

import com.healthtrack.validation.QuerySchemas;
import com.healthtrack.validation.ValidatedInput;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * A validated, 1-based page request.
 */
public record PageQuery(int page, int limit) {

    public PageQuery {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (limit < 1 || limit > QuerySchemas.MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + QuerySchemas.MAX_LIMIT);
        }
    }

    public static PageQuery from(ValidatedInput input) {
        return new PageQuery(
                input.getOrDefault(QuerySchemas.PAGE, Integer.class, QuerySchemas.DEFAULT_PAGE),
                input.getOrDefault(QuerySchemas.LIMIT, Integer.class, QuerySchemas.DEFAULT_LIMIT));
    }

    /** True when the first row of this page lies past what a JPA offset can address. */
    public boolean isBeyondOffsetLimit() {
        return (long) (page - 1) * limit > Integer.MAX_VALUE;
    }

    public Pageable toPageable(Sort sort) {
        return PageRequest.of(page - 1, limit, sort);
    }
}
