package io.b2mash.b2b.recordcore.paging;

public enum SortDirection {
  ASC,
  DESC;

  /** Unrecognized or missing input sorts descending. */
  public static SortDirection parse(String value) {
    return value != null && value.trim().equalsIgnoreCase("asc") ? ASC : DESC;
  }
}
