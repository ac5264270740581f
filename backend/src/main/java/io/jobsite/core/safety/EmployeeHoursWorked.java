package io.jobsite.core.safety;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** Hours reported for one project over one period, the denominator of every OSHA rate. */
@Entity
@Table(name = "employee_hours_worked")
public class EmployeeHoursWorked {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false)
  private UUID companyId;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "period_type", nullable = false, length = 20)
  private String periodType;

  @Column(name = "period_start", nullable = false)
  private LocalDate periodStart;

  @Column(name = "period_end", nullable = false)
  private LocalDate periodEnd;

  @Column(name = "total_hours", nullable = false, precision = 12, scale = 2)
  private BigDecimal totalHours;

  @Column(name = "average_employees")
  private Integer averageEmployees;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected EmployeeHoursWorked() {}

  public EmployeeHoursWorked(
      UUID companyId,
      UUID projectId,
      String periodType,
      LocalDate periodStart,
      LocalDate periodEnd,
      BigDecimal totalHours,
      Integer averageEmployees) {
    this.companyId = companyId;
    this.projectId = projectId;
    this.periodType = periodType;
    this.periodStart = periodStart;
    this.periodEnd = periodEnd;
    this.totalHours = totalHours;
    this.averageEmployees = averageEmployees;
    this.createdAt = Instant.now();
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

  public String getPeriodType() {
    return periodType;
  }

  public LocalDate getPeriodStart() {
    return periodStart;
  }

  public LocalDate getPeriodEnd() {
    return periodEnd;
  }

  public BigDecimal getTotalHours() {
    return totalHours;
  }

  public Integer getAverageEmployees() {
    return averageEmployees;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
