package io.jobsite.core.safety;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.jobsite.core.audit.AuditService;
import io.jobsite.core.exception.InvalidStateException;
import io.jobsite.core.security.SecurityConfig;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SafetyMetricsController.class)
@Import(SecurityConfig.class)
class SafetyMetricsControllerTest {

  private static final UUID COMPANY_ID = UUID.randomUUID();
  private static final UUID MEMBER_ID = UUID.randomUUID();

  @Autowired private MockMvc mockMvc;

  @MockBean private SafetyMetricsService metricsService;
  @MockBean private AuditService auditService;
  @MockBean private JwtDecoder jwtDecoder;

  @Test
  void computeRate_returnsRoundedRate() throws Exception {
    when(metricsService.computeRate(RateKind.TRIR, 3, 0, new BigDecimal("100000")))
        .thenReturn(Optional.of(new BigDecimal("6.00")));

    mockMvc
        .perform(
            get("/api/safety/rates")
                .param("kind", "TRIR")
                .param("cases", "3")
                .param("hoursWorked", "100000")
                .with(jwtWithRole("member", "ROLE_COMPANY_MEMBER")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.kind").value("TRIR"))
        .andExpect(jsonPath("$.rate").value(6.0));
  }

  @Test
  void computeRate_zeroHours_returnsNullRate() throws Exception {
    when(metricsService.computeRate(RateKind.DART, 2, 0, BigDecimal.ZERO))
        .thenReturn(Optional.empty());

    mockMvc
        .perform(
            get("/api/safety/rates")
                .param("kind", "DART")
                .param("cases", "2")
                .param("hoursWorked", "0")
                .with(jwtWithRole("member", "ROLE_COMPANY_MEMBER")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.rate").doesNotExist());
  }

  @Test
  void aggregate_invalidRange_returns400() throws Exception {
    var start = LocalDate.of(2025, 3, 31);
    var end = LocalDate.of(2025, 3, 1);
    when(metricsService.aggregate(COMPANY_ID, null, start, end))
        .thenThrow(new InvalidStateException("Invalid period", "end date is before start date"));

    mockMvc
        .perform(
            get("/api/safety/metrics")
                .param("start", "2025-03-31")
                .param("end", "2025-03-01")
                .with(jwtWithRole("admin", "ROLE_COMPANY_ADMIN")))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid period"));
  }

  @Test
  void aggregate_tokenWithoutCompany_returns401() throws Exception {
    mockMvc
        .perform(
            get("/api/safety/metrics")
                .param("start", "2025-03-01")
                .param("end", "2025-03-31")
                .with(
                    jwt()
                        .jwt(j -> j.subject(MEMBER_ID.toString()))
                        .authorities(List.of(new SimpleGrantedAuthority("ROLE_COMPANY_MEMBER")))))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void createSnapshot_memberRole_returns403() throws Exception {
    mockMvc
        .perform(
            post("/api/safety/metrics/snapshots")
                .with(jwtWithRole("member", "ROLE_COMPANY_MEMBER"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"periodType": "MONTHLY", "year": 2025, "month": 3}
                    """))
        .andExpect(status().isForbidden());

    verify(metricsService, never())
        .createSnapshot(any(), any(), any(), anyInt(), any(), any(), any(), any());
  }

  @Test
  void createSnapshot_adminRole_returnsSnapshot() throws Exception {
    var snapshot =
        new SafetyMetricsSnapshot(
            COMPANY_ID,
            null,
            ReportingPeriod.of(PeriodType.MONTHLY, 2025, 3, null, LocalDate.of(2025, 4, 2)),
            MEMBER_ID);
    when(metricsService.createSnapshot(
            COMPANY_ID, null, PeriodType.MONTHLY, 2025, 3, null, null, MEMBER_ID))
        .thenReturn(snapshot);

    mockMvc
        .perform(
            post("/api/safety/metrics/snapshots")
                .with(jwtWithRole("admin", "ROLE_COMPANY_ADMIN"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"periodType": "MONTHLY", "year": 2025, "month": 3}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.periodLabel").value("Mar 2025"))
        .andExpect(jsonPath("$.month").value(3));
  }

  @Test
  void createSnapshot_monthOutOfRange_returns400() throws Exception {
    mockMvc
        .perform(
            post("/api/safety/metrics/snapshots")
                .with(jwtWithRole("owner", "ROLE_COMPANY_OWNER"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"periodType": "MONTHLY", "year": 2025, "month": 13}
                    """))
        .andExpect(status().isBadRequest());
  }

  private JwtRequestPostProcessor jwtWithRole(String role, String authority) {
    return jwt()
        .jwt(
            j ->
                j.subject(MEMBER_ID.toString())
                    .claim("company_id", COMPANY_ID.toString())
                    .claim("role", role))
        .authorities(List.of(new SimpleGrantedAuthority(authority)));
  }
}
