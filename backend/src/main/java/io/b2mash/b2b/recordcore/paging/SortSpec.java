package io.b2mash.b2b.recordcore.paging;

public record SortSpec(String field, SortDirection direction) {

  public static final SortSpec DEFAULT = new SortSpec("id", SortDirection.DESC);
}
