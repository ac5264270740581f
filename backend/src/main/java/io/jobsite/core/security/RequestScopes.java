package io.jobsite.core.security;

import io.jobsite.core.exception.MissingCompanyContextException;
import java.util.UUID;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

/** Caller identity for the current request, read from the authenticated bearer token. */
public final class RequestScopes {

  /** Member id of the caller. Throws if the request is not JWT-authenticated. */
  public static UUID requireMemberId() {
    return JwtClaims.requireMemberId(requireJwt());
  }

  /** Company the caller acts for. Throws if the token has no {@code company_id} claim. */
  public static UUID requireCompanyId() {
    return JwtClaims.requireCompanyId(requireJwt());
  }

  private static Jwt requireJwt() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (auth instanceof JwtAuthenticationToken jwtAuth) {
      return jwtAuth.getToken();
    }
    throw new MissingCompanyContextException("Request is not authenticated with a bearer token");
  }

  private RequestScopes() {}
}
