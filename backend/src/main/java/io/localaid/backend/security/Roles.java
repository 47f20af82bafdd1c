package io.localaid.backend.security;

/**
 * Centralized role constants used across authentication and authorization.
 *
 * <p>Platform roles come from the JWT {@code roles} claim. Spring authorities are the {@code ROLE_}
 * prefixed versions used by {@code @PreAuthorize}.
 */
public final class Roles {

  // Platform roles ("roles" claim values)
  public static final String ADMIN = "admin";
  public static final String ORGANIZER = "organizer";
  public static final String VOLUNTEER = "volunteer";

  // Spring Security granted authorities
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";
  public static final String AUTHORITY_ORGANIZER = "ROLE_ORGANIZER";
  public static final String AUTHORITY_VOLUNTEER = "ROLE_VOLUNTEER";

  private Roles() {}
}
