package io.b2mash.b2b.recordcore.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

class JwtRoleConverterTest {

  private final JwtRoleConverter converter = new JwtRoleConverter();

  @Test
  void usesUsernameClaimAndMapsRoleList() {
    Jwt jwt =
        baseJwt()
            .claim("username", "alice")
            .claim("roles", List.of("superadmin", "editor"))
            .build();

    AbstractAuthenticationToken token = converter.convert(jwt);

    assertThat(token.getName()).isEqualTo("alice");
    assertThat(token.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactlyInAnyOrder("ROLE_SUPERADMIN", "ROLE_EDITOR");
  }

  @Test
  void fallsBackToSubjectAndAcceptsCommaSeparatedRoles() {
    Jwt jwt = baseJwt().claim("roles", "viewer, superadmin").build();

    AbstractAuthenticationToken token = converter.convert(jwt);

    assertThat(token.getName()).isEqualTo("user-42");
    assertThat(token.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactlyInAnyOrder("ROLE_VIEWER", "ROLE_SUPERADMIN");
  }

  @Test
  void missingRolesMeansNoAuthorities() {
    AbstractAuthenticationToken token = converter.convert(baseJwt().build());

    assertThat(token.getAuthorities()).isEmpty();
  }

  private static Jwt.Builder baseJwt() {
    return Jwt.withTokenValue("token").header("alg", "HS256").subject("user-42");
  }
}
