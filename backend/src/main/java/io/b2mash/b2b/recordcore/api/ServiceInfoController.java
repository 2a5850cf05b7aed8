package io.b2mash.b2b.recordcore.api;

import io.b2mash.b2b.recordcore.config.RecordCoreProperties;
import java.util.LinkedHashMap;
import org.springframework.context.i18n.LocaleContextHolder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Unauthenticated service banner. */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

  private final RecordCoreProperties properties;
  private final ResponseEnvelopeFactory envelopes;

  public ServiceInfoController(
      RecordCoreProperties properties, ResponseEnvelopeFactory envelopes) {
    this.properties = properties;
    this.envelopes = envelopes;
  }

  @GetMapping
  public ResponseEntity<ApiResponse> index() {
    var info = new LinkedHashMap<String, Object>();
    info.put("title", properties.service().title());
    info.put("version", properties.service().version());
    info.put("language", LocaleContextHolder.getLocale().getLanguage());
    return envelopes.ok("success", info);
  }
}
