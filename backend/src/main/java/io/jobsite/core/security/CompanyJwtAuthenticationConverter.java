package io.jobsite.core.security;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
public class CompanyJwtAuthenticationConverter
    implements Converter<Jwt, AbstractAuthenticationToken> {

  private static final Map<String, String> ROLE_MAPPING =
      Map.of(
          Roles.COMPANY_OWNER, Roles.AUTHORITY_COMPANY_OWNER,
          Roles.COMPANY_ADMIN, Roles.AUTHORITY_COMPANY_ADMIN);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities = extractAuthorities(jwt);
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  // Every authenticated caller is at least a company member
  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    String role = JwtClaims.extractRole(jwt);
    String springRole =
        role == null
            ? Roles.AUTHORITY_COMPANY_MEMBER
            : ROLE_MAPPING.getOrDefault(role, Roles.AUTHORITY_COMPANY_MEMBER);
    return List.of(new SimpleGrantedAuthority(springRole));
  }
}
