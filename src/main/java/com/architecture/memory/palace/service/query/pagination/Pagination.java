package com.architecture.memory.palace.service.query.pagination;

/**
 * Offset pagination. Both values always reach the query as parameters.
 */
public record Pagination(long skip, long limit) {

    public Pagination {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must be >= 0, got " + skip);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, got " + limit);
        }
    }

    public static Pagination first(long limit) {
        return new Pagination(0, limit);
    }

    /**
     * @param page 1-based page number
     */
    public static Pagination ofPage(int page, int pageSize) {
        if (page < 1) {
            throw new IllegalArgumentException("Page number must be >= 1, got " + page);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be >= 1, got " + pageSize);
        }
        return new Pagination((long) (page - 1) * pageSize, pageSize);
    }

    /**
     * Rows the database has to produce before paging: skip + limit.
     */
    public long window() {
        return skip + limit;
    }
}
