package io.b2mash.b2b.recordcore.exception;

import java.util.List;
import java.util.Map;

public class NoEffectiveChangeException extends RecordCoreException {

  public NoEffectiveChangeException(String messageKey) {
    super(ErrorKind.NO_EFFECTIVE_CHANGE, messageKey, Map.of(), List.of());
  }
}
