package io.b2mash.b2b.recordcore.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Puts {@code requestId} and {@code actor} into the MDC for the duration of a request. */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final String MDC_REQUEST_ID = "requestId";
  private static final String MDC_ACTOR = "actor";

  private final ActorResolver actorResolver;

  public RequestLoggingFilter(ActorResolver actorResolver) {
    this.actorResolver = actorResolver;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());
      MDC.put(MDC_ACTOR, actorResolver.current().name());
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_ACTOR);
      MDC.remove(MDC_REQUEST_ID);
    }
  }
}
