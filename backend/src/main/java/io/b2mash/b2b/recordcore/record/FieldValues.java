package io.b2mash.b2b.recordcore.record;

import java.util.Optional;
import java.util.regex.Pattern;

/** Lenient readers for loosely typed request values. */
public final class FieldValues {

  private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");

  private FieldValues() {}

  /** Integral numbers and numeric strings; anything else is empty. */
  public static Optional<Long> asLong(Object value) {
    if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      return Optional.of(((Number) value).longValue());
    }
    if (value instanceof Number number) {
      double d = number.doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d)) {
        return Optional.of(number.longValue());
      }
      return Optional.empty();
    }
    if (value instanceof String s && INTEGER.matcher(s.trim()).matches()) {
      return Optional.of(Long.parseLong(s.trim()));
    }
    return Optional.empty();
  }

  public static boolean isBlank(Object value) {
    return value == null || (value instanceof String s && s.isBlank());
  }
}
