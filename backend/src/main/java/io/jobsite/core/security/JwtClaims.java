package io.jobsite.core.security;

import io.jobsite.core.exception.MissingCompanyContextException;
import java.util.UUID;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Reads the member and company identity out of a bearer token.
 *
 * <p>Token format: {@code { "sub": "<member uuid>", "company_id": "<company uuid>", "role":
 * "admin" }}
 */
public final class JwtClaims {

  private static final String COMPANY_CLAIM = "company_id";
  private static final String ROLE_CLAIM = "role";

  /** The member id carried in {@code sub}. Rejects tokens whose subject is not a UUID. */
  public static UUID requireMemberId(Jwt jwt) {
    UUID memberId = memberIdOrNull(jwt);
    if (memberId == null) {
      throw new MissingCompanyContextException("Token subject is not a member id");
    }
    return memberId;
  }

  public static UUID memberIdOrNull(Jwt jwt) {
    return parseUuid(jwt.getSubject());
  }

  /** The company the caller acts for ({@code company_id}). */
  public static UUID requireCompanyId(Jwt jwt) {
    UUID companyId = parseUuid(jwt.getClaimAsString(COMPANY_CLAIM));
    if (companyId == null) {
      throw new MissingCompanyContextException("Token carries no company_id claim");
    }
    return companyId;
  }

  public static String extractRole(Jwt jwt) {
    return jwt.getClaimAsString(ROLE_CLAIM);
  }

  private static UUID parseUuid(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return UUID.fromString(value);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private JwtClaims() {}
}
