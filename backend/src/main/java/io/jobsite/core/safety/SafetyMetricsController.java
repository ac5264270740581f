package io.jobsite.core.safety;

import io.jobsite.core.security.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SafetyMetricsController {

  private final SafetyMetricsService metricsService;

  public SafetyMetricsController(SafetyMetricsService metricsService) {
    this.metricsService = metricsService;
  }

  /** Rate is null when hours are zero or missing. */
  @GetMapping("/api/safety/rates")
  @PreAuthorize("hasAnyRole('COMPANY_MEMBER', 'COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<RateResponse> computeRate(
      @RequestParam RateKind kind,
      @RequestParam long cases,
      @RequestParam(defaultValue = "0") long daysRestricted,
      @RequestParam(required = false) BigDecimal hoursWorked) {
    var rate = metricsService.computeRate(kind, cases, daysRestricted, hoursWorked);
    return ResponseEntity.ok(new RateResponse(kind, rate.orElse(null)));
  }

  @GetMapping("/api/safety/metrics")
  @PreAuthorize("hasAnyRole('COMPANY_MEMBER', 'COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<MetricsBundle> aggregate(
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
      @RequestParam(required = false) UUID projectId) {
    UUID companyId = RequestScopes.requireCompanyId();
    return ResponseEntity.ok(metricsService.aggregate(companyId, projectId, start, end));
  }

  @PostMapping("/api/safety/metrics/snapshots")
  @PreAuthorize("hasAnyRole('COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<SnapshotResponse> createSnapshot(
      @Valid @RequestBody CreateSnapshotRequest request) {
    UUID companyId = RequestScopes.requireCompanyId();
    UUID memberId = RequestScopes.requireMemberId();
    var snapshot =
        metricsService.createSnapshot(
            companyId,
            request.projectId(),
            request.periodType(),
            request.year(),
            request.month(),
            request.quarter(),
            request.naicsCode(),
            memberId);
    return ResponseEntity.ok(SnapshotResponse.from(snapshot));
  }

  @GetMapping("/api/safety/metrics/trend")
  @PreAuthorize("hasAnyRole('COMPANY_MEMBER', 'COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<List<MetricsTrendPoint>> getTrend(
      @RequestParam(required = false) UUID projectId,
      @RequestParam(defaultValue = "MONTHLY") PeriodType periodType,
      @RequestParam(defaultValue = "12") int limit) {
    UUID companyId = RequestScopes.requireCompanyId();
    return ResponseEntity.ok(metricsService.getTrend(companyId, projectId, periodType, limit));
  }

  // --- DTOs ---

  public record RateResponse(RateKind kind, BigDecimal rate) {}

  public record CreateSnapshotRequest(
      UUID projectId,
      @NotNull(message = "periodType is required") PeriodType periodType,
      @Min(1900) @Max(9999) int year,
      @Min(1) @Max(12) Integer month,
      @Min(1) @Max(4) Integer quarter,
      @Size(max = 10) String naicsCode) {}

  public record SnapshotResponse(
      UUID id,
      UUID companyId,
      UUID projectId,
      PeriodType periodType,
      int year,
      Integer month,
      Integer quarter,
      String periodLabel,
      LocalDate snapshotDate,
      BigDecimal totalHoursWorked,
      int averageEmployees,
      int totalRecordableCases,
      int deaths,
      int daysAwayCases,
      int restrictedDutyCases,
      int dartCases,
      int otherRecordableCases,
      int lostTimeCases,
      int seriousCases,
      int totalDaysAway,
      int totalDaysRestricted,
      BigDecimal trir,
      BigDecimal dart,
      BigDecimal ltir,
      BigDecimal severityRate,
      String industryCode,
      BigDecimal industryAvgTrir,
      BigDecimal industryAvgDart,
      BigDecimal industryAvgLtir,
      Instant calculatedAt) {

    public static SnapshotResponse from(SafetyMetricsSnapshot s) {
      return new SnapshotResponse(
          s.getId(),
          s.getCompanyId(),
          s.getProjectId(),
          s.getPeriodType(),
          s.getYear(),
          s.getMonth(),
          s.getQuarter(),
          s.periodLabel(),
          s.getSnapshotDate(),
          s.getTotalHoursWorked(),
          s.getAverageEmployees(),
          s.getTotalRecordableCases(),
          s.getDeaths(),
          s.getDaysAwayCases(),
          s.getRestrictedDutyCases(),
          s.getDartCases(),
          s.getOtherRecordableCases(),
          s.getLostTimeCases(),
          s.getSeriousCases(),
          s.getTotalDaysAway(),
          s.getTotalDaysRestricted(),
          s.getTrir(),
          s.getDart(),
          s.getLtir(),
          s.getSeverityRate(),
          s.getIndustryCode(),
          s.getIndustryAvgTrir(),
          s.getIndustryAvgDart(),
          s.getIndustryAvgLtir(),
          s.getCalculatedAt());
    }
  }
}
