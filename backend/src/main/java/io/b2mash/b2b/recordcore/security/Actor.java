package io.b2mash.b2b.recordcore.security;

import java.util.Set;

/**
 * Who performs a write. Passed explicitly into the lifecycle instead of being read from ambient
 * state.
 *
 * @param name recorded in the change log
 * @param privileges lower-case role names
 */
public record Actor(String name, Set<String> privileges) {

  public static final String SYSTEM = "system";

  public Actor {
    name = name != null && !name.isBlank() ? name : SYSTEM;
    privileges = privileges != null ? Set.copyOf(privileges) : Set.of();
  }

  public static Actor system() {
    return new Actor(SYSTEM, Set.of());
  }

  public static Actor of(String name, String... privileges) {
    return new Actor(name, Set.of(privileges));
  }

  public boolean isPrivileged() {
    return privileges.contains(Roles.SUPERADMIN);
  }
}
