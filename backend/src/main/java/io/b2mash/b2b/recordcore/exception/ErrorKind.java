package io.b2mash.b2b.recordcore.exception;

import org.springframework.http.HttpStatus;

/** Error taxonomy of the record core and the HTTP status each kind is reported with. */
public enum ErrorKind {
  VALIDATION_FAILED(HttpStatus.UNPROCESSABLE_ENTITY),
  INVALID_STATUS_TRANSITION(HttpStatus.UNPROCESSABLE_ENTITY),
  LOCK_CONFLICT(HttpStatus.CONFLICT),
  NO_EFFECTIVE_CHANGE(HttpStatus.BAD_REQUEST),
  DEPENDENCY_BLOCKED(HttpStatus.UNPROCESSABLE_ENTITY),
  PERMISSION_DENIED(HttpStatus.FORBIDDEN),
  NOT_FOUND(HttpStatus.NOT_FOUND),
  STORAGE_FAILURE(HttpStatus.UNPROCESSABLE_ENTITY);

  private final HttpStatus httpStatus;

  ErrorKind(HttpStatus httpStatus) {
    this.httpStatus = httpStatus;
  }

  public HttpStatus httpStatus() {
    return httpStatus;
  }
}
