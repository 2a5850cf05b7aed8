package io.b2mash.b2b.recordcore.security;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/** Turns the authenticated principal into an {@link Actor}; no authentication means system. */
@Component
public class ActorResolver {

  public Actor current() {
    return fromAuthentication(SecurityContextHolder.getContext().getAuthentication());
  }

  public Actor fromAuthentication(Authentication authentication) {
    if (authentication == null
        || !authentication.isAuthenticated()
        || authentication instanceof AnonymousAuthenticationToken) {
      return Actor.system();
    }
    Set<String> privileges =
        authentication.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .filter(authority -> authority != null && authority.startsWith(Roles.AUTHORITY_PREFIX))
            .map(
                authority ->
                    authority.substring(Roles.AUTHORITY_PREFIX.length()).toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    return new Actor(authentication.getName(), privileges);
  }
}
