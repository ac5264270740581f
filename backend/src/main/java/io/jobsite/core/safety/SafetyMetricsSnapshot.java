package io.jobsite.core.safety;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Stored metrics for one (company, project, period) key. The key columns are fixed at creation;
 * recalculation replaces every computed field in place so the snapshot keeps its id.
 */
@Entity
@Table(name = "safety_metrics_snapshots")
public class SafetyMetricsSnapshot {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false, updatable = false)
  private UUID companyId;

  @Column(name = "project_id", updatable = false)
  private UUID projectId;

  @Enumerated(EnumType.STRING)
  @Column(name = "period_type", nullable = false, length = 20, updatable = false)
  private PeriodType periodType;

  @Column(name = "year", nullable = false, updatable = false)
  private int year;

  @Column(name = "month", updatable = false)
  private Integer month;

  @Column(name = "quarter", updatable = false)
  private Integer quarter;

  @Column(name = "snapshot_date", nullable = false)
  private LocalDate snapshotDate;

  @Column(name = "total_hours_worked", nullable = false, precision = 14, scale = 2)
  private BigDecimal totalHoursWorked;

  @Column(name = "average_employees", nullable = false)
  private int averageEmployees;

  @Column(name = "total_recordable_cases", nullable = false)
  private int totalRecordableCases;

  @Column(name = "deaths", nullable = false)
  private int deaths;

  @Column(name = "days_away_cases", nullable = false)
  private int daysAwayCases;

  @Column(name = "restricted_duty_cases", nullable = false)
  private int restrictedDutyCases;

  @Column(name = "dart_cases", nullable = false)
  private int dartCases;

  @Column(name = "other_recordable_cases", nullable = false)
  private int otherRecordableCases;

  @Column(name = "lost_time_cases", nullable = false)
  private int lostTimeCases;

  @Column(name = "serious_cases", nullable = false)
  private int seriousCases;

  @Column(name = "total_days_away", nullable = false)
  private int totalDaysAway;

  @Column(name = "total_days_restricted", nullable = false)
  private int totalDaysRestricted;

  @Column(name = "trir", precision = 8, scale = 2)
  private BigDecimal trir;

  @Column(name = "dart", precision = 8, scale = 2)
  private BigDecimal dart;

  @Column(name = "ltir", precision = 8, scale = 2)
  private BigDecimal ltir;

  @Column(name = "severity_rate", precision = 10, scale = 2)
  private BigDecimal severityRate;

  @Column(name = "industry_code", length = 10)
  private String industryCode;

  @Column(name = "industry_avg_trir", precision = 8, scale = 2)
  private BigDecimal industryAvgTrir;

  @Column(name = "industry_avg_dart", precision = 8, scale = 2)
  private BigDecimal industryAvgDart;

  @Column(name = "industry_avg_ltir", precision = 8, scale = 2)
  private BigDecimal industryAvgLtir;

  @Column(name = "calculated_at", nullable = false)
  private Instant calculatedAt;

  @Column(name = "created_by")
  private UUID createdBy;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected SafetyMetricsSnapshot() {}

  public SafetyMetricsSnapshot(
      UUID companyId, UUID projectId, ReportingPeriod period, UUID createdBy) {
    this.companyId = companyId;
    this.projectId = projectId;
    this.periodType = period.periodType();
    this.year = period.year();
    this.month = period.month();
    this.quarter = period.quarter();
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
  }

  /** Replaces all computed fields. Industry averages are cleared when {@code benchmark} is null. */
  public void applyMetrics(
      MetricsBundle metrics, String industryCode, BenchmarkRates benchmark) {
    this.snapshotDate = metrics.end();
    this.totalHoursWorked = metrics.totalHoursWorked();
    this.averageEmployees = metrics.averageEmployees();
    this.totalRecordableCases = metrics.recordableCases();
    this.deaths = metrics.fatalities();
    this.daysAwayCases = metrics.daysAwayCases();
    this.restrictedDutyCases = metrics.restrictedCases();
    this.dartCases = metrics.dartCases();
    this.otherRecordableCases = metrics.otherRecordableCases();
    this.lostTimeCases = metrics.lostTimeCases();
    this.seriousCases = metrics.seriousCases();
    this.totalDaysAway = metrics.totalDaysAway();
    this.totalDaysRestricted = metrics.totalDaysRestricted();
    this.trir = metrics.trir();
    this.dart = metrics.dart();
    this.ltir = metrics.ltir();
    this.severityRate = metrics.severityRate();
    this.industryCode = industryCode;
    this.industryAvgTrir = benchmark != null ? benchmark.avgTrir() : null;
    this.industryAvgDart = benchmark != null ? benchmark.avgDart() : null;
    this.industryAvgLtir = benchmark != null ? benchmark.avgLtir() : null;
    this.calculatedAt = Instant.now();
  }

  public String periodLabel() {
    return ReportingPeriod.label(periodType, year, month, quarter);
  }

  public UUID getId() {
    return id;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public PeriodType getPeriodType() {
    return periodType;
  }

  public int getYear() {
    return year;
  }

  public Integer getMonth() {
    return month;
  }

  public Integer getQuarter() {
    return quarter;
  }

  public LocalDate getSnapshotDate() {
    return snapshotDate;
  }

  public BigDecimal getTotalHoursWorked() {
    return totalHoursWorked;
  }

  public int getAverageEmployees() {
    return averageEmployees;
  }

  public int getTotalRecordableCases() {
    return totalRecordableCases;
  }

  public int getDeaths() {
    return deaths;
  }

  public int getDaysAwayCases() {
    return daysAwayCases;
  }

  public int getRestrictedDutyCases() {
    return restrictedDutyCases;
  }

  public int getDartCases() {
    return dartCases;
  }

  public int getOtherRecordableCases() {
    return otherRecordableCases;
  }

  public int getLostTimeCases() {
    return lostTimeCases;
  }

  public int getSeriousCases() {
    return seriousCases;
  }

  public int getTotalDaysAway() {
    return totalDaysAway;
  }

  public int getTotalDaysRestricted() {
    return totalDaysRestricted;
  }

  public BigDecimal getTrir() {
    return trir;
  }

  public BigDecimal getDart() {
    return dart;
  }

  public BigDecimal getLtir() {
    return ltir;
  }

  public BigDecimal getSeverityRate() {
    return severityRate;
  }

  public String getIndustryCode() {
    return industryCode;
  }

  public BigDecimal getIndustryAvgTrir() {
    return industryAvgTrir;
  }

  public BigDecimal getIndustryAvgDart() {
    return industryAvgDart;
  }

  public BigDecimal getIndustryAvgLtir() {
    return industryAvgLtir;
  }

  public Instant getCalculatedAt() {
    return calculatedAt;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
