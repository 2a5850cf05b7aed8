package io.b2mash.b2b.recordcore.api;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.recordcore.config.RecordCoreConfig;
import io.b2mash.b2b.recordcore.exception.FieldViolation;
import io.b2mash.b2b.recordcore.exception.LockConflictException;
import io.b2mash.b2b.recordcore.exception.ValidationFailedException;
import io.b2mash.b2b.recordcore.paging.PageSpec;
import io.b2mash.b2b.recordcore.paging.PagedResult;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.context.support.ResourceBundleMessageSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class ResponseEnvelopeFactoryTest {

  private final ResponseEnvelopeFactory envelopes = new ResponseEnvelopeFactory(messageSource());

  @AfterEach
  void resetLocale() {
    LocaleContextHolder.resetLocaleContext();
  }

  @Test
  void successEnvelopeCarriesData() {
    LocaleContextHolder.setLocale(Locale.ENGLISH);

    ResponseEntity<ApiResponse> response =
        envelopes.ok("createRecordSuccess", Map.of("id", 1));

    ApiResponse body = response.getBody();
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(body.code()).isEqualTo(200);
    assertThat(body.success()).isTrue();
    assertThat(body.message()).isEqualTo("Data has been saved successfully.");
    assertThat(body.errors()).isNull();
  }

  @Test
  void pageEnvelopeReportsDisplayCount() {
    var result = new PagedResult<>(List.of("a", "b"), new PageSpec(2, 2, 6, 2));

    ApiResponse body = envelopes.page(result).getBody();

    assertThat(body.pagination()).isEqualTo(new PageMeta(2, 2, 6, 2));
    assertThat(body.data()).isEqualTo(List.of("a", "b"));
  }

  @Test
  void validationErrorsRenderLabelsAndArguments() {
    LocaleContextHolder.setLocale(Locale.ENGLISH);
    var ex =
        new ValidationFailedException(
            List.of(
                FieldViolation.of("name", "required"),
                FieldViolation.of("name", "stringTooLong", "max", 255)));

    ResponseEntity<ApiResponse> response = envelopes.error(ex);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    ApiResponse body = response.getBody();
    assertThat(body.success()).isFalse();
    assertThat(body.message()).isEqualTo("Field validation failed.");
    assertThat(body.errors())
        .containsExactly(
            new ErrorDetail("name", "Name cannot be blank."),
            new ErrorDetail("name", "Name should contain at most 255 characters."));
  }

  @Test
  void indonesianLocaleIsUsedWhenRequested() {
    LocaleContextHolder.setLocale(RecordCoreConfig.INDONESIAN);

    ApiResponse body =
        envelopes
            .error(ValidationFailedException.of(FieldViolation.of("name", "required")))
            .getBody();

    assertThat(body.message()).isEqualTo("Validasi gagal.");
    assertThat(body.errors()).containsExactly(new ErrorDetail("name", "Nama tidak boleh kosong."));
  }

  @Test
  void lockConflictIsAConflict() {
    LocaleContextHolder.setLocale(Locale.ENGLISH);

    ResponseEntity<ApiResponse> response = envelopes.error(new LockConflictException());

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody().errors()).isEmpty();
  }

  @Test
  void unknownKeyFallsBackToTheKey() {
    assertThat(envelopes.message("noSuchKey")).isEqualTo("noSuchKey");
  }

  private static ResourceBundleMessageSource messageSource() {
    var source = new ResourceBundleMessageSource();
    source.setBasename("i18n/messages");
    source.setDefaultEncoding("UTF-8");
    source.setFallbackToSystemLocale(false);
    return source;
  }
}
