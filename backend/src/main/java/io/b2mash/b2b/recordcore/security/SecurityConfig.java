package io.b2mash.b2b.recordcore.security;

import io.b2mash.b2b.recordcore.config.RecordCoreProperties;
import java.nio.charset.StandardCharsets;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.server.resource.web.authentication.BearerTokenAuthenticationFilter;
import org.springframework.security.web.SecurityFilterChain;

@Configuration
@EnableWebSecurity
@EnableMethodSecurity
public class SecurityConfig {

  /** HS256 needs a key of at least 256 bits. */
  private static final int MIN_SECRET_BYTES = 32;

  private final JwtRoleConverter jwtRoleConverter;
  private final EnvelopeAuthenticationEntryPoint authenticationEntryPoint;
  private final RequestLoggingFilter requestLoggingFilter;

  public SecurityConfig(
      JwtRoleConverter jwtRoleConverter,
      EnvelopeAuthenticationEntryPoint authenticationEntryPoint,
      RequestLoggingFilter requestLoggingFilter) {
    this.jwtRoleConverter = jwtRoleConverter;
    this.authenticationEntryPoint = authenticationEntryPoint;
    this.requestLoggingFilter = requestLoggingFilter;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers("/actuator/health", "/actuator/info")
                    .permitAll()
                    .requestMatchers(HttpMethod.GET, "/api/v1")
                    .permitAll()
                    .requestMatchers("/api/**")
                    .authenticated()
                    .anyRequest()
                    .denyAll())
        .oauth2ResourceServer(
            oauth2 ->
                oauth2
                    .jwt(jwt -> jwt.jwtAuthenticationConverter(jwtRoleConverter))
                    .authenticationEntryPoint(authenticationEntryPoint))
        .exceptionHandling(handling -> handling.authenticationEntryPoint(authenticationEntryPoint))
        .addFilterAfter(requestLoggingFilter, BearerTokenAuthenticationFilter.class);

    return http.build();
  }

  @Bean
  JwtDecoder jwtDecoder(RecordCoreProperties properties) {
    String secret = properties.security().jwtSecret();
    if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      throw new IllegalStateException(
          "recordcore.security.jwt-secret must be set to at least "
              + MIN_SECRET_BYTES
              + " bytes");
    }
    var key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
    return NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
  }
}
