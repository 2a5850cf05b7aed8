package io.b2mash.b2b.recordcore.paging;

public final class Paginator {

  private Paginator() {}

  /**
   * Effective size is {@code min(totalCount, requestedSize ?? defaultSize)} so the limit never
   * exceeds the available rows. A page past the last one is clamped to the last page.
   *
   * @throws IllegalArgumentException if {@code page} is below 1 or a size is negative
   */
  public static PageSpec resolvePage(
      int page, Integer requestedSize, long totalCount, int defaultSize) {
    if (page < 1) {
      throw new IllegalArgumentException("page must be >= 1, was " + page);
    }
    int size = requestedSize != null ? requestedSize : defaultSize;
    if (size < 0 || totalCount < 0) {
      throw new IllegalArgumentException(
          "size and totalCount must not be negative: size=" + size + ", totalCount=" + totalCount);
    }
    int effective = (int) Math.min(totalCount, size);
    int resolved = page;
    if (effective > 0) {
      long lastPage = (totalCount + effective - 1) / effective;
      resolved = (int) Math.min(page, lastPage);
    }
    long offset = (long) (resolved - 1) * effective;
    return new PageSpec(resolved, effective, totalCount, offset);
  }
}
