package io.b2mash.b2b.recordcore.api;

import io.b2mash.b2b.recordcore.paging.PageSpec;

/**
 * @param display number of records in this page
 */
public record PageMeta(int page, int pageSize, long totalCount, int display) {

  public static PageMeta of(PageSpec spec, int display) {
    return new PageMeta(spec.page(), spec.pageSize(), spec.totalCount(), display);
  }
}
