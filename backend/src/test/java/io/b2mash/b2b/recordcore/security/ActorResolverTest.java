package io.b2mash.b2b.recordcore.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

class ActorResolverTest {

  private final ActorResolver resolver = new ActorResolver();

  @AfterEach
  void clearContext() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void noAuthenticationIsTheSystemActor() {
    Actor actor = resolver.current();

    assertThat(actor.name()).isEqualTo(Actor.SYSTEM);
    assertThat(actor.isPrivileged()).isFalse();
  }

  @Test
  void anonymousIsTheSystemActor() {
    var anonymous =
        new AnonymousAuthenticationToken(
            "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS"));

    assertThat(resolver.fromAuthentication(anonymous).name()).isEqualTo(Actor.SYSTEM);
  }

  @Test
  void superadminRoleMakesActorPrivileged() {
    var authentication =
        UsernamePasswordAuthenticationToken.authenticated(
            "alice",
            null,
            List.of(
                new SimpleGrantedAuthority(Roles.AUTHORITY_SUPERADMIN),
                new SimpleGrantedAuthority("SCOPE_read")));
    SecurityContextHolder.getContext().setAuthentication(authentication);

    Actor actor = resolver.current();

    assertThat(actor.name()).isEqualTo("alice");
    assertThat(actor.privileges()).containsExactly("superadmin");
    assertThat(actor.isPrivileged()).isTrue();
  }

  @Test
  void blankNameFallsBackToSystem() {
    assertThat(new Actor(" ", null).name()).isEqualTo(Actor.SYSTEM);
  }
}
