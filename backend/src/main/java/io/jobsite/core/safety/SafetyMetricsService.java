package io.jobsite.core.safety;

import io.jobsite.core.audit.AuditEventBuilder;
import io.jobsite.core.audit.AuditService;
import io.jobsite.core.exception.InvalidStateException;
import io.jobsite.core.exception.ResourceConflictException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SafetyMetricsService {

  private static final Logger log = LoggerFactory.getLogger(SafetyMetricsService.class);

  private final SafetyIncidentRepository incidentRepository;
  private final EmployeeHoursWorkedRepository hoursRepository;
  private final SafetyMetricsSnapshotRepository snapshotRepository;
  private final IndustryBenchmarkService benchmarkService;
  private final SafetyMetricsProperties properties;
  private final AuditService auditService;

  public SafetyMetricsService(
      SafetyIncidentRepository incidentRepository,
      EmployeeHoursWorkedRepository hoursRepository,
      SafetyMetricsSnapshotRepository snapshotRepository,
      IndustryBenchmarkService benchmarkService,
      SafetyMetricsProperties properties,
      AuditService auditService) {
    this.incidentRepository = incidentRepository;
    this.hoursRepository = hoursRepository;
    this.snapshotRepository = snapshotRepository;
    this.benchmarkService = benchmarkService;
    this.properties = properties;
    this.auditService = auditService;
  }

  /**
   * Single rate. For {@link RateKind#SEVERITY} {@code cases} is the days away and {@code
   * daysRestricted} is added to it; other kinds ignore {@code daysRestricted}.
   */
  public Optional<BigDecimal> computeRate(
      RateKind kind, long cases, long daysRestricted, BigDecimal hoursWorked) {
    if (kind == RateKind.SEVERITY) {
      return OshaRates.severity(cases, daysRestricted, hoursWorked);
    }
    return OshaRates.compute(kind, cases, hoursWorked);
  }

  /** Counts and rates for the company, or one of its projects, over [start, end]. */
  @Transactional(readOnly = true)
  public MetricsBundle aggregate(UUID companyId, UUID projectId, LocalDate start, LocalDate end) {
    if (start == null || end == null) {
      throw new InvalidStateException("Invalid period", "start and end dates are required");
    }
    if (end.isBefore(start)) {
      throw new InvalidStateException(
          "Invalid period", "end date " + end + " is before start date " + start);
    }
    var incidents = incidentRepository.findLiveInPeriod(companyId, projectId, start, end);
    var hours = hoursRepository.findOverlapping(companyId, projectId, start, end);
    return MetricsBundle.compute(start, end, incidents, hours);
  }

  @Transactional
  public SafetyMetricsSnapshot createSnapshot(
      UUID companyId,
      UUID projectId,
      PeriodType periodType,
      int year,
      Integer month,
      Integer quarter,
      String naicsCode,
      UUID createdBy) {
    return createSnapshot(
        companyId,
        projectId,
        periodType,
        year,
        month,
        quarter,
        naicsCode,
        createdBy,
        LocalDate.now());
  }

  /**
   * Aggregates the period and upserts its snapshot. An existing snapshot with the same key keeps
   * its id and has its computed fields replaced.
   */
  @Transactional
  public SafetyMetricsSnapshot createSnapshot(
      UUID companyId,
      UUID projectId,
      PeriodType periodType,
      int year,
      Integer month,
      Integer quarter,
      String naicsCode,
      UUID createdBy,
      LocalDate today) {
    var period = ReportingPeriod.of(periodType, year, month, quarter, today);
    var metrics = aggregate(companyId, projectId, period.start(), period.end());

    String industryCode =
        naicsCode != null && !naicsCode.isBlank() ? naicsCode : properties.defaultNaicsCode();
    var benchmark = benchmarkService.find(industryCode, year).orElse(null);

    var existing =
        snapshotRepository.findByCompanyIdAndProjectIdAndPeriodTypeAndYearAndMonthAndQuarter(
            companyId,
            projectId,
            period.periodType(),
            period.year(),
            period.month(),
            period.quarter());
    boolean created = existing.isEmpty();
    var snapshot =
        existing.orElseGet(
            () -> new SafetyMetricsSnapshot(companyId, projectId, period, createdBy));
    snapshot.applyMetrics(metrics, industryCode, benchmark);

    try {
      snapshot = snapshotRepository.saveAndFlush(snapshot);
    } catch (DataIntegrityViolationException e) {
      log.warn(
          "Snapshot key collision for company {} project {} {}: {}",
          companyId,
          projectId,
          period.label(),
          e.getMessage());
      throw new ResourceConflictException(
          "Snapshot conflict",
          "A snapshot for " + period.label() + " was created concurrently. Please retry.");
    }

    log.info(
        "{} safety metrics snapshot {} for company {} project {} ({} {}): trir={}, dart={}",
        created ? "Created" : "Refreshed",
        snapshot.getId(),
        companyId,
        projectId,
        periodType,
        period.label(),
        snapshot.getTrir(),
        snapshot.getDart());

    var details = new HashMap<String, Object>();
    details.put("period_type", periodType.name());
    details.put("period", period.label());
    details.put("created", created);
    if (projectId != null) {
      details.put("project_id", projectId.toString());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("safety_metrics_snapshot.upserted")
            .entityType("safety_metrics_snapshot")
            .entityId(snapshot.getId())
            .details(details)
            .build());

    return snapshot;
  }

  /** Latest snapshots first. A null project returns company-wide snapshots only. */
  @Transactional(readOnly = true)
  public List<MetricsTrendPoint> getTrend(
      UUID companyId, UUID projectId, PeriodType periodType, int limit) {
    if (limit < 1) {
      throw new InvalidStateException("Invalid limit", "limit must be positive: " + limit);
    }
    var page = PageRequest.of(0, limit);
    var snapshots =
        projectId == null
            ? snapshotRepository.findCompanyTrend(companyId, periodType, page)
            : snapshotRepository.findProjectTrend(companyId, projectId, periodType, page);
    return snapshots.stream().map(MetricsTrendPoint::from).toList();
  }
}
