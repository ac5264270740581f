package io.jobsite.core.nearmiss;

import io.jobsite.core.safety.SafetyMetricsProperties;
import io.jobsite.core.security.RequestScopes;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Omitted tuning parameters fall back to the {@code safety.metrics.*} defaults. */
@RestController
public class NearMissController {

  private final NearMissAnalyticsService analyticsService;
  private final SafetyMetricsProperties properties;

  public NearMissController(
      NearMissAnalyticsService analyticsService, SafetyMetricsProperties properties) {
    this.analyticsService = analyticsService;
    this.properties = properties;
  }

  @GetMapping("/api/safety/near-misses/spikes")
  @PreAuthorize("hasAnyRole('COMPANY_MEMBER', 'COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<List<SpikeDay>> detectSpikes(
      @RequestParam(required = false) UUID projectId,
      @RequestParam(required = false) @Min(2) @Max(NearMissAnalyticsService.MAX_WINDOW_DAYS)
          Integer lookbackDays,
      @RequestParam(required = false) Double threshold,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate asOf) {
    UUID companyId = RequestScopes.requireCompanyId();
    return ResponseEntity.ok(
        analyticsService.detectFrequencySpikes(
            companyId,
            projectId,
            lookbackDays != null ? lookbackDays : properties.spikeLookbackDays(),
            threshold != null ? threshold : properties.spikeThreshold(),
            asOf != null ? asOf : LocalDate.now()));
  }

  @GetMapping("/api/safety/near-misses/hotspots")
  @PreAuthorize("hasAnyRole('COMPANY_MEMBER', 'COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<List<LocationHotspot>> detectHotspots(
      @RequestParam(required = false) UUID projectId,
      @RequestParam(required = false) Integer minIncidents,
      @RequestParam(required = false) @Min(1) @Max(NearMissAnalyticsService.MAX_WINDOW_DAYS)
          Integer days,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate asOf) {
    UUID companyId = RequestScopes.requireCompanyId();
    return ResponseEntity.ok(
        analyticsService.detectLocationHotspots(
            companyId,
            projectId,
            minIncidents != null ? minIncidents : properties.hotspotMinIncidents(),
            days != null ? days : properties.hotspotDays(),
            asOf != null ? asOf : LocalDate.now()));
  }

  @GetMapping("/api/safety/near-misses/trend")
  @PreAuthorize("hasAnyRole('COMPANY_MEMBER', 'COMPANY_ADMIN', 'COMPANY_OWNER')")
  public ResponseEntity<NearMissTrend> calculateTrend(
      @RequestParam(required = false) UUID projectId,
      @RequestParam(required = false) @Min(1) @Max(NearMissAnalyticsService.MAX_WINDOW_DAYS)
          Integer periodDays,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate asOf) {
    UUID companyId = RequestScopes.requireCompanyId();
    return ResponseEntity.ok(
        analyticsService.calculateTrend(
            companyId,
            projectId,
            periodDays != null ? periodDays : properties.trendPeriodDays(),
            asOf != null ? asOf : LocalDate.now()));
  }
}
