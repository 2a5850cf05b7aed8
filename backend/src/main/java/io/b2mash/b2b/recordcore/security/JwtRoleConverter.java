package io.b2mash.b2b.recordcore.security;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Maps the {@code roles} claim to {@code ROLE_*} authorities and uses the {@code username} claim
 * (falling back to {@code sub}) as the principal name.
 */
@Component
public class JwtRoleConverter implements Converter<Jwt, AbstractAuthenticationToken> {

  static final String USERNAME_CLAIM = "username";
  static final String ROLES_CLAIM = "roles";

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    String username = jwt.getClaimAsString(USERNAME_CLAIM);
    String name = username != null && !username.isBlank() ? username : jwt.getSubject();
    return new JwtAuthenticationToken(jwt, extractAuthorities(jwt), name);
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    Object claim = jwt.getClaim(ROLES_CLAIM);
    List<String> roles;
    if (claim instanceof Collection<?> values) {
      roles = values.stream().map(String::valueOf).toList();
    } else if (claim instanceof String single && !single.isBlank()) {
      roles = List.of(single.split(","));
    } else {
      return List.of();
    }
    return roles.stream()
        .map(String::trim)
        .filter(role -> !role.isEmpty())
        .map(role -> (GrantedAuthority) new SimpleGrantedAuthority(toAuthority(role)))
        .toList();
  }

  static String toAuthority(String role) {
    return Roles.AUTHORITY_PREFIX + role.toUpperCase(Locale.ROOT);
  }
}
