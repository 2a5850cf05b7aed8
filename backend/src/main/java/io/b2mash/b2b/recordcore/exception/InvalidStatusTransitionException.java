package io.b2mash.b2b.recordcore.exception;

import io.b2mash.b2b.recordcore.status.RecordStatus;
import java.util.List;
import java.util.Map;

public class InvalidStatusTransitionException extends RecordCoreException {

  private final RecordStatus from;
  private final RecordStatus to;

  public InvalidStatusTransitionException(RecordStatus from, RecordStatus to) {
    super(
        ErrorKind.INVALID_STATUS_TRANSITION,
        "invalidStatusTransition",
        Map.of(),
        List.of(
            FieldViolation.of(
                "status", "cannotChangeStatus", "value", from.label(), "newValue", to.label())));
    this.from = from;
    this.to = to;
  }

  public RecordStatus getFrom() {
    return from;
  }

  public RecordStatus getTo() {
    return to;
  }
}
