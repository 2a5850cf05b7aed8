package io.b2mash.b2b.recordcore.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * The one response shape of the API. Success responses carry {@code data} (and {@code pagination}
 * for searches); error responses carry {@code errors}, possibly empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"code", "success", "message", "pagination", "data", "errors"})
public record ApiResponse(
    int code,
    boolean success,
    String message,
    PageMeta pagination,
    Object data,
    List<ErrorDetail> errors) {

  public static ApiResponse ok(int code, String message, Object data) {
    return new ApiResponse(code, true, message, null, data, null);
  }

  public static ApiResponse page(int code, String message, PageMeta pagination, Object data) {
    return new ApiResponse(code, true, message, pagination, data, null);
  }

  public static ApiResponse error(int code, String message, List<ErrorDetail> errors) {
    return new ApiResponse(code, false, message, null, null, List.copyOf(errors));
  }
}
