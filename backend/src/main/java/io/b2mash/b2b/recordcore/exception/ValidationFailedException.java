package io.b2mash.b2b.recordcore.exception;

import java.util.List;
import java.util.Map;

public class ValidationFailedException extends RecordCoreException {

  public ValidationFailedException(List<FieldViolation> violations) {
    this("validationFailed", violations);
  }

  public ValidationFailedException(String messageKey, List<FieldViolation> violations) {
    super(ErrorKind.VALIDATION_FAILED, messageKey, Map.of(), violations);
  }

  public static ValidationFailedException of(FieldViolation violation) {
    return new ValidationFailedException(List.of(violation));
  }
}
