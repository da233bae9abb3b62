package com.healthtrack.validation;

/**
 * Rules shared by every paginated list endpoint.
 */
public final class QuerySchemas {

    public static final String PAGE = "page";
    public static final String LIMIT = "limit";

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    private QuerySchemas() {
    }

    public static FieldRule page() {
        return FieldRule.integer(PAGE).bounds(1, null).message("Page must be a positive integer");
    }

    public static FieldRule limit() {
        return FieldRule.integer(LIMIT).bounds(1, MAX_LIMIT).message("Limit must be between 1 and " + MAX_LIMIT);
    }
}
