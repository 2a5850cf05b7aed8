package io.b2mash.b2b.recordcore.filter;

import io.b2mash.b2b.recordcore.changelog.ChangeLog;
import io.b2mash.b2b.recordcore.exception.FieldViolation;
import io.b2mash.b2b.recordcore.exception.ValidationFailedException;
import io.b2mash.b2b.recordcore.status.RecordStatus;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * Accumulates filter predicates from sparse caller input. Every method ignores null or blank input,
 * so search parameters can be passed through without checks. The result is rendered by {@link
 * RelationalFilterRenderer} or {@link DocumentFilterRenderer}.
 *
 * <p>Fields are named by the request parameter that supplied them; that name is what a validation
 * error points at.
 */
public class RecordFilterBuilder {

  private static final String DETAIL_COLUMN = "detail";

  private final List<FilterPredicate> predicates = new ArrayList<>();

  public RecordFilterBuilder equalsFilter(String field, Object value) {
    return equalsFilter(FieldRef.column(field), value);
  }

  public RecordFilterBuilder equalsFilter(FieldRef field, Object value) {
    if (!isBlank(value)) {
      predicates.add(new FilterPredicate.Equals(field, value));
    }
    return this;
  }

  /** Integer equality; a non-numeric value is a validation error on {@code field}. */
  public RecordFilterBuilder integerFilter(String field, Object value) {
    if (!isBlank(value)) {
      predicates.add(new FilterPredicate.Equals(FieldRef.column(field), parseLong(field, value)));
    }
    return this;
  }

  public RecordFilterBuilder likeFilter(String field, String value) {
    return likeFilter(FieldRef.column(field), value);
  }

  /** {@code "john doe"} matches anything containing "john" followed later by "doe". */
  public RecordFilterBuilder likeFilter(FieldRef field, String value) {
    if (!isBlank(value)) {
      var tokens = Arrays.stream(value.trim().split("\\s+")).toList();
      predicates.add(new FilterPredicate.Like(field, tokens));
    }
    return this;
  }

  public RecordFilterBuilder exactStringFilter(String field, String value) {
    if (!isBlank(value)) {
      predicates.add(new FilterPredicate.ExactString(FieldRef.column(field), value.trim()));
    }
    return this;
  }

  /** Splits {@code "1,2,3"} into a set-membership predicate. */
  public RecordFilterBuilder multiValueFilter(String field, String csv) {
    if (isBlank(csv)) {
      return this;
    }
    var values = new ArrayList<Long>();
    for (String token : csv.split(",")) {
      if (!token.isBlank()) {
        values.add(parseLong(field, token.trim()));
      }
    }
    if (!values.isEmpty()) {
      predicates.add(new FilterPredicate.MemberOf(FieldRef.column(field), values));
    }
    return this;
  }

  /**
   * Always added, even without a value: deleted records stay hidden unless {@code value} asks for
   * them.
   */
  public RecordFilterBuilder statusFilter(String field, Object value) {
    RecordStatus requested = null;
    if (!isBlank(value)) {
      long code = parseLong(field, value);
      requested =
          RecordStatus.fromCode((int) code)
              .filter(s -> s.code() == code)
              .orElseThrow(
                  () ->
                      ValidationFailedException.of(
                          FieldViolation.of(
                              field, "valueNotInList", "value", RecordStatus.codeList())));
    }
    predicates.add(new FilterPredicate.StatusIs(FieldRef.column(field), requested));
    return this;
  }

  /** {@code "2024-01-01,2024-01-31"} is an inclusive range, a single date an exact day. */
  public RecordFilterBuilder dateRangeFilter(String field, String combinedValue) {
    return dateRangeFilter(field, FieldRef.column(field), combinedValue);
  }

  /** Date filter on {@code detail.changeLog.<logField>}. */
  public RecordFilterBuilder changeLogDateFilter(String logField, String combinedValue) {
    return dateRangeFilter(
        logField, FieldRef.json(DETAIL_COLUMN, ChangeLog.DETAIL_KEY, logField), combinedValue);
  }

  /** Case-insensitive match on the actor stored in {@code detail.changeLog.<logField>}. */
  public RecordFilterBuilder changeLogUserFilter(String logField, String value) {
    return likeFilter(FieldRef.json(DETAIL_COLUMN, ChangeLog.DETAIL_KEY, logField), value);
  }

  public RecordFilterBuilder jsonEqualsFilter(String column, List<String> path, String value) {
    return equalsFilter(new FieldRef(column, path), value);
  }

  /** Groups whatever {@code group} adds into one OR predicate. */
  public RecordFilterBuilder or(Consumer<RecordFilterBuilder> group) {
    var nested = new RecordFilterBuilder();
    group.accept(nested);
    if (nested.predicates.size() == 1) {
      predicates.add(nested.predicates.get(0));
    } else if (!nested.predicates.isEmpty()) {
      predicates.add(new FilterPredicate.AnyOf(nested.predicates));
    }
    return this;
  }

  public FilterSpec build() {
    return new FilterSpec(predicates);
  }

  private RecordFilterBuilder dateRangeFilter(
      String parameter, FieldRef field, String combinedValue) {
    if (isBlank(combinedValue)) {
      return this;
    }
    LocalDate from;
    LocalDate to;
    if (combinedValue.contains(",")) {
      String[] bounds = combinedValue.split(",", 2);
      from = parseDate(parameter, bounds[0]);
      to = parseDate(parameter, bounds[1]);
    } else {
      from = parseDate(parameter, combinedValue);
      to = from;
    }
    predicates.add(new FilterPredicate.DateRange(field, from, to));
    return this;
  }

  private static LocalDate parseDate(String field, String value) {
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException e) {
      throw ValidationFailedException.of(FieldViolation.of(field, "date"));
    }
  }

  private static long parseLong(String field, Object value) {
    if (value instanceof Integer || value instanceof Long) {
      return ((Number) value).longValue();
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException e) {
      throw ValidationFailedException.of(FieldViolation.of(field, "integer"));
    }
  }

  private static boolean isBlank(Object value) {
    return value == null || (value instanceof String s && s.isBlank());
  }
}
