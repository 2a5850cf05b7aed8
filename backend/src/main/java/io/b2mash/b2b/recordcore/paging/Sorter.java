package io.b2mash.b2b.recordcore.paging;

import io.b2mash.b2b.recordcore.exception.FieldViolation;
import io.b2mash.b2b.recordcore.exception.ValidationFailedException;
import java.util.Set;
import java.util.stream.Collectors;

public final class Sorter {

  public static final String SORT_BY = "sortBy";

  private Sorter() {}

  /**
   * Resolves the sort column and direction; missing field sorts by {@code id}.
   *
   * @throws ValidationFailedException if the field is not one of {@code sortableFields}
   */
  public static SortSpec resolveSort(String field, String direction, Set<String> sortableFields) {
    String resolved = field == null || field.isBlank() ? SortSpec.DEFAULT.field() : field.trim();
    if (!sortableFields.contains(resolved)) {
      String allowed = sortableFields.stream().sorted().collect(Collectors.joining(", "));
      throw ValidationFailedException.of(
          FieldViolation.of(SORT_BY, "valueNotInList", "value", allowed));
    }
    return new SortSpec(resolved, SortDirection.parse(direction));
  }
}
