package io.jobsite.core.security;

/**
 * Centralized role constants used across authentication, authorization, and approver resolution.
 *
 * <p>Company roles come from the JWT {@code role} claim. Default-role codes are stored on {@code
 * members.default_role} and are what role-based approval steps match against. Spring authorities
 * are the {@code ROLE_} prefixed versions used by {@code @PreAuthorize}.
 */
public final class Roles {

  // Company-level roles (JWT "role" claim values)
  public static final String COMPANY_OWNER = "owner";
  public static final String COMPANY_ADMIN = "admin";
  public static final String COMPANY_MEMBER = "member";

  // Spring Security granted authorities
  public static final String AUTHORITY_COMPANY_OWNER = "ROLE_COMPANY_OWNER";
  public static final String AUTHORITY_COMPANY_ADMIN = "ROLE_COMPANY_ADMIN";
  public static final String AUTHORITY_COMPANY_MEMBER = "ROLE_COMPANY_MEMBER";

  private Roles() {}
}
