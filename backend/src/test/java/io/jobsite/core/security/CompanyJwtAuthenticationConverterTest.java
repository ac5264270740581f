package io.jobsite.core.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.UUID;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

class CompanyJwtAuthenticationConverterTest {

  private final CompanyJwtAuthenticationConverter converter =
      new CompanyJwtAuthenticationConverter();

  @Test
  void convert_ownerRole_mapsToOwnerAuthority() {
    var token = converter.convert(jwt(b -> b.claim("role", "owner")));

    assertThat(token.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactly(Roles.AUTHORITY_COMPANY_OWNER);
  }

  @Test
  void convert_adminRole_mapsToAdminAuthority() {
    var token = converter.convert(jwt(b -> b.claim("role", "admin")));

    assertThat(token.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactly(Roles.AUTHORITY_COMPANY_ADMIN);
  }

  @Test
  void convert_fieldRoleOrMissingRole_mapsToMemberAuthority() {
    var foreman = converter.convert(jwt(b -> b.claim("role", "foreman")));
    var noRole = converter.convert(jwt(b -> {}));

    assertThat(foreman.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactly(Roles.AUTHORITY_COMPANY_MEMBER);
    assertThat(noRole.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactly(Roles.AUTHORITY_COMPANY_MEMBER);
  }

  @Test
  void convert_usesSubjectAsPrincipalName() {
    var memberId = UUID.randomUUID();

    var token = converter.convert(jwt(b -> b.subject(memberId.toString())));

    assertThat(token.getName()).isEqualTo(memberId.toString());
  }

  private static Jwt jwt(Consumer<Jwt.Builder> customizer) {
    var builder =
        Jwt.withTokenValue("token")
            .header("alg", "RS256")
            .subject(UUID.randomUUID().toString())
            .claim("company_id", UUID.randomUUID().toString())
            .issuedAt(Instant.now())
            .expiresAt(Instant.now().plusSeconds(300));
    customizer.accept(builder);
    return builder.build();
  }
}
