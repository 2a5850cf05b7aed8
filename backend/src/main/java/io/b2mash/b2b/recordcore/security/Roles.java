package io.b2mash.b2b.recordcore.security;

/** Role names carried in the JWT {@code roles} claim and their Spring authorities. */
public final class Roles {

  public static final String SUPERADMIN = "superadmin";

  public static final String AUTHORITY_PREFIX = "ROLE_";
  public static final String AUTHORITY_SUPERADMIN = AUTHORITY_PREFIX + "SUPERADMIN";

  private Roles() {}
}
