package io.b2mash.b2b.recordcore.lifecycle;

import io.b2mash.b2b.recordcore.exception.FieldViolation;
import io.b2mash.b2b.recordcore.exception.ValidationFailedException;
import io.b2mash.b2b.recordcore.record.FieldSpec;
import io.b2mash.b2b.recordcore.record.FieldType;
import io.b2mash.b2b.recordcore.record.FieldValues;
import io.b2mash.b2b.recordcore.record.RecordFields;
import io.b2mash.b2b.recordcore.record.RecordType;
import io.b2mash.b2b.recordcore.record.Scenario;
import io.b2mash.b2b.recordcore.record.ScenarioFields;
import io.b2mash.b2b.recordcore.record.TextSanitizer;
import io.b2mash.b2b.recordcore.status.RecordStatus;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Request field checks, split in two passes: structure (unknown, missing, id and lockVersion
 * format) before the record is loaded, values (types, lengths) after the lock check.
 */
final class FieldValidator {

  private static final FieldSpec DETAIL_SPEC = FieldSpec.of(RecordFields.DETAIL, FieldType.OBJECT);

  private FieldValidator() {}

  static ValidatedRequest checkStructure(
      RecordType<?> type, Scenario scenario, Map<String, Object> params) {
    Map<String, Object> input = params != null ? params : Map.of();
    ScenarioFields fields = type.fieldsFor(scenario);
    var violations = new ArrayList<FieldViolation>();

    for (String key : input.keySet()) {
      if (!fields.permitted().contains(key)) {
        violations.add(FieldViolation.of(key, "invalidField"));
      }
    }
    for (String name : orderedFields(type, fields.required())) {
      if (!input.containsKey(name) || isMissing(input.get(name))) {
        violations.add(FieldViolation.of(name, "required"));
      }
    }

    Long id = null;
    if (input.containsKey(RecordFields.ID) && !FieldValues.isBlank(input.get(RecordFields.ID))) {
      id = FieldValues.asLong(input.get(RecordFields.ID)).filter(v -> v > 0).orElse(null);
      if (id == null) {
        violations.add(FieldViolation.of(RecordFields.ID, "integerNoZero"));
      }
    }
    Integer lockVersion = null;
    Object rawLock = input.get(RecordFields.LOCK_VERSION);
    if (!FieldValues.isBlank(rawLock)) {
      lockVersion =
          FieldValues.asLong(rawLock)
              .filter(v -> v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE)
              .map(Long::intValue)
              .orElse(null);
      if (lockVersion == null) {
        violations.add(FieldViolation.of(RecordFields.LOCK_VERSION, "integer"));
      }
    }

    if (!violations.isEmpty()) {
      throw new ValidationFailedException(violations);
    }

    var values = new LinkedHashMap<String, Object>(input);
    values.remove(RecordFields.ID);
    values.remove(RecordFields.LOCK_VERSION);
    return new ValidatedRequest(id, lockVersion, values);
  }

  // Markup-only text is stored as null, so it cannot satisfy a required field.
  private static boolean isMissing(Object value) {
    return FieldValues.isBlank(value)
        || (value instanceof String text && TextSanitizer.plainText(text) == null);
  }

  static RecordStatus parseStatus(Object raw) {
    return FieldValues.asLong(raw)
        .filter(code -> code >= 0 && code <= Integer.MAX_VALUE)
        .flatMap(code -> RecordStatus.fromCode(code.intValue()))
        .orElseThrow(
            () ->
                ValidationFailedException.of(
                    FieldViolation.of(
                        RecordFields.STATUS, "valueNotInList", "value", RecordStatus.codeList())));
  }

  /** Type, length and shape checks for the submitted values. Status is checked separately. */
  static void checkValues(RecordType<?> type, Map<String, Object> values) {
    var specs = new ArrayList<>(type.fieldSpecs());
    specs.add(DETAIL_SPEC);
    var violations = new ArrayList<FieldViolation>();
    for (FieldSpec spec : specs) {
      if (!values.containsKey(spec.name()) || values.get(spec.name()) == null) {
        continue;
      }
      FieldViolation violation = check(spec, values.get(spec.name()));
      if (violation != null) {
        violations.add(violation);
      }
    }
    if (!violations.isEmpty()) {
      throw new ValidationFailedException(violations);
    }
  }

  private static FieldViolation check(FieldSpec spec, Object value) {
    switch (spec.type()) {
      case STRING:
        return checkString(spec, value);
      case INTEGER:
        return FieldValues.asLong(value).isPresent()
            ? null
            : FieldViolation.of(spec.name(), "integer");
      case OBJECT:
        return value instanceof Map<?, ?> ? null : FieldViolation.of(spec.name(), "array");
      default:
        return null;
    }
  }

  private static FieldViolation checkString(FieldSpec spec, Object value) {
    if (!(value instanceof String text)) {
      return FieldViolation.of(spec.name(), "string");
    }
    if (spec.maxLength() != null && text.length() > spec.maxLength()) {
      return FieldViolation.of(spec.name(), "stringTooLong", "max", spec.maxLength());
    }
    return null;
  }

  private static List<String> orderedFields(RecordType<?> type, Set<String> names) {
    var ordered = new LinkedHashSet<String>();
    ordered.add(RecordFields.ID);
    type.fieldSpecs().forEach(spec -> ordered.add(spec.name()));
    ordered.add(RecordFields.STATUS);
    ordered.add(RecordFields.DETAIL);
    ordered.add(RecordFields.LOCK_VERSION);
    names.stream().sorted().forEach(ordered::add);
    return ordered.stream().filter(names::contains).toList();
  }
}
