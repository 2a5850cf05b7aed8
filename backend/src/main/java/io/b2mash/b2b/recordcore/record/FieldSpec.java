package io.b2mash.b2b.recordcore.record;

/**
 * Value constraints of one writable field.
 *
 * @param maxLength only used for {@link FieldType#STRING}; null means unbounded
 */
public record FieldSpec(String name, FieldType type, Integer maxLength) {

  public static FieldSpec string(String name, int maxLength) {
    return new FieldSpec(name, FieldType.STRING, maxLength);
  }

  public static FieldSpec of(String name, FieldType type) {
    return new FieldSpec(name, type, null);
  }
}
