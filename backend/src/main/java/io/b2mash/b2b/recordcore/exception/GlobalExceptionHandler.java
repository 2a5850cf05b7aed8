package io.b2mash.b2b.recordcore.exception;

import io.b2mash.b2b.recordcore.api.ApiResponse;
import io.b2mash.b2b.recordcore.api.ResponseEnvelopeFactory;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/** Renders every failure as the error envelope. */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private final ResponseEnvelopeFactory envelopes;

  public GlobalExceptionHandler(ResponseEnvelopeFactory envelopes) {
    this.envelopes = envelopes;
  }

  @ExceptionHandler(RecordCoreException.class)
  public ResponseEntity<ApiResponse> handleRecordCore(
      RecordCoreException ex, HttpServletRequest request) {
    log.warn(
        "Request rejected: path={}, method={}, kind={}, message={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getKind(),
        ex.getMessage());
    return envelopes.error(ex);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ApiResponse> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());
    return envelopes.error(HttpStatus.FORBIDDEN, "unauthorizedAccess");
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ApiResponse> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    return envelopes.error(HttpStatus.CONFLICT, "lockVersionOutdated");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
    log.error(
        "Unhandled exception: path={}, method={}",
        request.getRequestURI(),
        request.getMethod(),
        ex);
    return envelopes.error(HttpStatus.INTERNAL_SERVER_ERROR, "unknownError");
  }

  /** Framework-level MVC errors (unreadable body, unsupported method, ...) use the envelope too. */
  @Override
  protected ResponseEntity<Object> handleExceptionInternal(
      Exception ex,
      Object body,
      HttpHeaders headers,
      HttpStatusCode statusCode,
      WebRequest request) {
    HttpStatus status = HttpStatus.resolve(statusCode.value());
    if (status == null) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
    }
    String messageKey;
    if (status == HttpStatus.NOT_FOUND) {
      messageKey = "dataNotFound";
    } else if (status.is4xxClientError()) {
      messageKey = "badRequest";
    } else {
      messageKey = "serverError";
    }
    log.warn("MVC error: status={}, exception={}", status.value(), ex.getClass().getSimpleName());
    return ResponseEntity.status(status)
        .headers(headers)
        .body(envelopes.errorBody(status, messageKey));
  }
}
