package io.b2mash.b2b.recordcore.filter;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A filterable location: either a plain column or a path inside a jsonb column. Identifiers are
 * checked on construction since renderers inline them into SQL.
 */
public record FieldRef(String column, List<String> jsonPath) {

  private static final Pattern COLUMN = Pattern.compile("[a-z_][a-z0-9_]*");
  private static final Pattern JSON_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  public FieldRef {
    if (column == null || !COLUMN.matcher(column).matches()) {
      throw new IllegalArgumentException("Invalid column identifier: " + column);
    }
    jsonPath = jsonPath != null ? List.copyOf(jsonPath) : List.of();
    for (String key : jsonPath) {
      if (!JSON_KEY.matcher(key).matches()) {
        throw new IllegalArgumentException("Invalid json path element: " + key);
      }
    }
  }

  public static FieldRef column(String column) {
    return new FieldRef(column, List.of());
  }

  public static FieldRef json(String column, String... path) {
    return new FieldRef(column, List.of(path));
  }

  public boolean isJson() {
    return !jsonPath.isEmpty();
  }

  /** Dotted path as used by the document store, e.g. {@code detail.changeLog.createdAt}. */
  public String dottedPath() {
    return isJson() ? column + "." + String.join(".", jsonPath) : column;
  }
}
