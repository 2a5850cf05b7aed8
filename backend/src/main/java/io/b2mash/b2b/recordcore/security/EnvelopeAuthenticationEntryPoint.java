package io.b2mash.b2b.recordcore.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.b2b.recordcore.api.ResponseEnvelopeFactory;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/** Logs failed authentication and answers 401 with the error envelope. */
@Component
public class EnvelopeAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private static final Logger log = LoggerFactory.getLogger(EnvelopeAuthenticationEntryPoint.class);

  private final ResponseEnvelopeFactory envelopes;
  private final ObjectMapper objectMapper;

  public EnvelopeAuthenticationEntryPoint(
      ResponseEnvelopeFactory envelopes, ObjectMapper objectMapper) {
    this.envelopes = envelopes;
    this.objectMapper = objectMapper;
  }

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    log.warn(
        "security.auth_failed: path={}, method={}, reason={}, remote_addr={}",
        request.getRequestURI(),
        request.getMethod(),
        authException.getMessage(),
        request.getRemoteAddr());

    response.setStatus(HttpStatus.UNAUTHORIZED.value());
    response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding("UTF-8");
    objectMapper.writeValue(
        response.getOutputStream(),
        envelopes.errorBody(HttpStatus.UNAUTHORIZED, "unauthorizedAccess"));
  }
}
