package io.b2mash.b2b.recordcore.exception;

import java.util.List;
import java.util.Map;

/** The caller worked on an outdated copy; it has to refetch, not fix a field. */
public class LockConflictException extends RecordCoreException {

  public LockConflictException() {
    super(ErrorKind.LOCK_CONFLICT, "lockVersionOutdated", Map.of(), List.of());
  }
}
