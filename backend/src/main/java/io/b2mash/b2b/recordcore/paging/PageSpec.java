package io.b2mash.b2b.recordcore.paging;

/**
 * Resolved page window for one request.
 *
 * @param page 1-based page number
 * @param pageSize effective size, never larger than {@code totalCount}
 * @param totalCount rows matching the filter
 * @param offset rows to skip
 */
public record PageSpec(int page, int pageSize, long totalCount, long offset) {}
