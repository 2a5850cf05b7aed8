package io.b2mash.b2b.recordcore.api;

import io.b2mash.b2b.recordcore.exception.FieldViolation;
import io.b2mash.b2b.recordcore.exception.RecordCoreException;
import io.b2mash.b2b.recordcore.paging.PagedResult;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.context.MessageSource;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Builds {@link ApiResponse} envelopes, rendering message keys in the request locale. Messages use
 * named placeholders ({@code {label}}, {@code {value}}); a {@code label} argument is itself looked
 * up as {@code field.<label>} so field names read naturally in each language.
 */
@Component
public class ResponseEnvelopeFactory {

  private static final String LABEL = "label";
  private static final String FIELD_PREFIX = "field.";

  private final MessageSource messageSource;

  public ResponseEnvelopeFactory(MessageSource messageSource) {
    this.messageSource = messageSource;
  }

  public ResponseEntity<ApiResponse> ok(String messageKey, Object data) {
    return ResponseEntity.ok(ApiResponse.ok(HttpStatus.OK.value(), message(messageKey), data));
  }

  public ResponseEntity<ApiResponse> page(PagedResult<?> result) {
    var meta = PageMeta.of(result.page(), result.items().size());
    return ResponseEntity.ok(
        ApiResponse.page(HttpStatus.OK.value(), message("success"), meta, result.items()));
  }

  public ResponseEntity<ApiResponse> error(RecordCoreException ex) {
    HttpStatus status = ex.getKind().httpStatus();
    List<ErrorDetail> errors =
        ex.getViolations().stream().map(this::toErrorDetail).toList();
    return ResponseEntity.status(status)
        .body(
            ApiResponse.error(
                status.value(), message(ex.getMessageKey(), ex.getMessageArgs()), errors));
  }

  public ResponseEntity<ApiResponse> error(HttpStatus status, String messageKey) {
    return ResponseEntity.status(status).body(errorBody(status, messageKey));
  }

  public ApiResponse errorBody(HttpStatus status, String messageKey) {
    return ApiResponse.error(status.value(), message(messageKey), List.of());
  }

  public String message(String key) {
    return message(key, Map.of());
  }

  public String message(String key, Map<String, Object> args) {
    Locale locale = LocaleContextHolder.getLocale();
    String template = messageSource.getMessage(key, null, key, locale);
    if (template == null || args.isEmpty()) {
      return template;
    }
    String rendered = template;
    for (var entry : args.entrySet()) {
      Object value = entry.getValue();
      if (LABEL.equals(entry.getKey()) && value != null) {
        value = messageSource.getMessage(FIELD_PREFIX + value, null, value.toString(), locale);
      }
      rendered = rendered.replace("{" + entry.getKey() + "}", String.valueOf(value));
    }
    return rendered;
  }

  private ErrorDetail toErrorDetail(FieldViolation violation) {
    return new ErrorDetail(violation.field(), message(violation.messageKey(), violation.args()));
  }
}
