package io.b2mash.b2b.recordcore.exception;

import java.util.List;
import java.util.Map;

/**
 * Base of every failure the record core raises on purpose. Carries a message key (resolved against
 * {@code i18n/messages}) instead of a rendered message.
 */
public abstract class RecordCoreException extends RuntimeException {

  private final ErrorKind kind;
  private final String messageKey;
  private final Map<String, Object> messageArgs;
  private final List<FieldViolation> violations;

  protected RecordCoreException(
      ErrorKind kind,
      String messageKey,
      Map<String, Object> messageArgs,
      List<FieldViolation> violations) {
    this(kind, messageKey, messageArgs, violations, null);
  }

  protected RecordCoreException(
      ErrorKind kind,
      String messageKey,
      Map<String, Object> messageArgs,
      List<FieldViolation> violations,
      Throwable cause) {
    super(describe(messageKey, violations), cause);
    this.kind = kind;
    this.messageKey = messageKey;
    this.messageArgs = messageArgs != null ? Map.copyOf(messageArgs) : Map.of();
    this.violations = violations != null ? List.copyOf(violations) : List.of();
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getMessageKey() {
    return messageKey;
  }

  public Map<String, Object> getMessageArgs() {
    return messageArgs;
  }

  public List<FieldViolation> getViolations() {
    return violations;
  }

  private static String describe(String messageKey, List<FieldViolation> violations) {
    if (violations == null || violations.isEmpty()) {
      return messageKey;
    }
    return messageKey
        + " "
        + violations.stream().map(v -> v.field() + ":" + v.messageKey()).toList();
  }
}
