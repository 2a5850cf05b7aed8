package io.b2mash.b2b.recordcore.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed search request.
 *
 * @param page 1-based
 * @param pageSize null means the configured default
 * @param filters remaining filter parameters, keyed by parameter name
 */
public record SearchCriteria(
    int page, Integer pageSize, String sortBy, String sortDir, Map<String, Object> filters) {

  public SearchCriteria {
    filters = Collections.unmodifiableMap(new LinkedHashMap<>(filters));
  }

  /** Filter value as text, or null when absent. */
  public String text(String name) {
    Object value = filters.get(name);
    return value != null ? value.toString() : null;
  }
}
