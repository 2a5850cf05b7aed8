package io.b2mash.b2b.recordcore.exception;

import java.util.List;
import java.util.Map;

/** Persistence failed for a reason outside validation (I/O, database constraint). */
public class StorageFailureException extends RecordCoreException {

  public StorageFailureException(String messageKey, Throwable cause) {
    super(ErrorKind.STORAGE_FAILURE, messageKey, Map.of(), List.of(), cause);
  }
}
