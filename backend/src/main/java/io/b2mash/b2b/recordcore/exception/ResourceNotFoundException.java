package io.b2mash.b2b.recordcore.exception;

import java.util.List;
import java.util.Map;

public class ResourceNotFoundException extends RecordCoreException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        ErrorKind.NOT_FOUND,
        "dataNotFound",
        Map.of("resource", resourceType, "id", String.valueOf(id)),
        List.of());
  }

  private ResourceNotFoundException(String messageKey) {
    super(ErrorKind.NOT_FOUND, messageKey, Map.of(), List.of());
  }

  public static ResourceNotFoundException withKey(String messageKey) {
    return new ResourceNotFoundException(messageKey);
  }
}
