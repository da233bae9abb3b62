package com.healthtrack.query;

/**
 * Pagination block returned alongside every list.
 */
public record PageMeta(
        int currentPage,
        int totalPages,
        long totalItems,
        int itemsPerPage,
        boolean hasNextPage,
        boolean hasPrevPage
) {

    public static PageMeta of(PageQuery query, long totalItems) {
        int totalPages = (int) ((totalItems + query.limit() - 1) / query.limit());
        return new PageMeta(
                query.page(),
                totalPages,
                totalItems,
                query.limit(),
                query.page() < totalPages,
                query.page() > 1);
    }
}
