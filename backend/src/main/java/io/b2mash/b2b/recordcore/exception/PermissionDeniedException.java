package io.b2mash.b2b.recordcore.exception;

import java.util.List;
import java.util.Map;

public class PermissionDeniedException extends RecordCoreException {

  public PermissionDeniedException(String messageKey) {
    this(messageKey, Map.of());
  }

  public PermissionDeniedException(String messageKey, Map<String, Object> messageArgs) {
    super(ErrorKind.PERMISSION_DENIED, messageKey, messageArgs, List.of());
  }
}
