package io.b2mash.b2b.recordcore.paging;

import java.util.List;

public record PagedResult<T>(List<T> items, PageSpec page) {

  public PagedResult {
    items = List.copyOf(items);
  }
}
