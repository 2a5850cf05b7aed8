package io.b2mash.b2b.recordcore.query;

import io.b2mash.b2b.recordcore.exception.FieldViolation;
import io.b2mash.b2b.recordcore.exception.ValidationFailedException;
import io.b2mash.b2b.recordcore.record.FieldValues;
import io.b2mash.b2b.recordcore.record.RecordType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Validates raw search parameters and splits paging/sorting from filters. */
@Component
public class SearchParameterParser {

  public static final String PAGE = "page";
  public static final String PAGE_SIZE = "pageSize";
  public static final String SORT_BY = "sortBy";
  public static final String SORT_DIR = "sortDir";

  /** Filters every record type supports. */
  public static final List<String> COMMON_FILTERS =
      List.of(
          "id",
          "status",
          "createdAt",
          "createdBy",
          "updatedAt",
          "updatedBy",
          "deletedAt",
          "deletedBy");

  private static final List<String> PAGING = List.of(PAGE, PAGE_SIZE, SORT_BY, SORT_DIR);

  public SearchCriteria parse(RecordType<?> type, Map<String, Object> params) {
    Map<String, Object> input = params != null ? params : Map.of();
    Set<String> accepted = acceptedParameters(type);
    var violations = new ArrayList<FieldViolation>();

    for (String key : input.keySet()) {
      if (!accepted.contains(key)) {
        violations.add(FieldViolation.of(key, "invalidField"));
      }
    }

    int page = 1;
    Object rawPage = input.get(PAGE);
    if (!FieldValues.isBlank(rawPage)) {
      Optional<Long> parsed = FieldValues.asLong(rawPage);
      if (parsed.isEmpty()) {
        violations.add(FieldViolation.of(PAGE, "integer"));
      } else if (parsed.get() <= 0 || parsed.get() > Integer.MAX_VALUE) {
        violations.add(FieldViolation.of(PAGE, "pageMustBeGreaterThanZero"));
      } else {
        page = parsed.get().intValue();
      }
    }

    Integer pageSize = null;
    Object rawSize = input.get(PAGE_SIZE);
    if (!FieldValues.isBlank(rawSize)) {
      Optional<Long> parsed = FieldValues.asLong(rawSize);
      if (parsed.isEmpty() || parsed.get() <= 0 || parsed.get() > Integer.MAX_VALUE) {
        violations.add(FieldViolation.of(PAGE_SIZE, "integerNoZero"));
      } else {
        pageSize = parsed.get().intValue();
      }
    }

    if (!violations.isEmpty()) {
      throw new ValidationFailedException(violations);
    }

    var filters = new LinkedHashMap<String, Object>(input);
    PAGING.forEach(filters::remove);
    return new SearchCriteria(
        page, pageSize, text(input.get(SORT_BY)), text(input.get(SORT_DIR)), filters);
  }

  static Set<String> acceptedParameters(RecordType<?> type) {
    var accepted = new LinkedHashSet<String>(PAGING);
    accepted.addAll(COMMON_FILTERS);
    accepted.addAll(type.searchParameters());
    return accepted;
  }

  private static String text(Object value) {
    return value != null ? value.toString() : null;
  }
}
