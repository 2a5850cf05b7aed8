package io.b2mash.b2b.recordcore.exception;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A field-level problem, kept as a message key plus named arguments so it can be rendered in the
 * caller's language at the response boundary.
 */
public record FieldViolation(String field, String messageKey, Map<String, Object> args) {

  public FieldViolation {
    args = args != null ? Map.copyOf(args) : Map.of();
  }

  public static FieldViolation of(String field, String messageKey) {
    return new FieldViolation(field, messageKey, Map.of("label", field));
  }

  public static FieldViolation of(String field, String messageKey, Object... keyValues) {
    if (keyValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected key/value pairs: " + Arrays.toString(keyValues));
    }
    var args = new LinkedHashMap<String, Object>();
    args.put("label", field);
    for (int i = 0; i < keyValues.length; i += 2) {
      args.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
    }
    return new FieldViolation(field, messageKey, args);
  }
}
