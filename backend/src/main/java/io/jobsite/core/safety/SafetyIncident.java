package io.jobsite.core.safety;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Incident as recorded by the incident intake service. Read by the metrics and near-miss
 * analytics; this service never edits incidents.
 */
@Entity
@Table(name = "safety_incidents")
public class SafetyIncident {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false)
  private UUID companyId;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Enumerated(EnumType.STRING)
  @Column(name = "severity", nullable = false, length = 30)
  private IncidentSeverity severity;

  @Column(name = "incident_date", nullable = false)
  private LocalDate incidentDate;

  @Column(name = "days_away_from_work", nullable = false)
  private int daysAwayFromWork;

  @Column(name = "days_restricted_duty", nullable = false)
  private int daysRestrictedDuty;

  @Column(name = "osha_recordable", nullable = false)
  private boolean oshaRecordable;

  @Column(name = "location", length = 255)
  private String location;

  @Enumerated(EnumType.STRING)
  @Column(name = "potential_severity", length = 30)
  private IncidentSeverity potentialSeverity;

  @Column(name = "root_cause_category", length = 100)
  private String rootCauseCategory;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected SafetyIncident() {}

  public SafetyIncident(
      UUID companyId,
      UUID projectId,
      IncidentSeverity severity,
      LocalDate incidentDate,
      int daysAwayFromWork,
      int daysRestrictedDuty,
      boolean oshaRecordable) {
    this.companyId = companyId;
    this.projectId = projectId;
    this.severity = severity;
    this.incidentDate = incidentDate;
    this.daysAwayFromWork = daysAwayFromWork;
    this.daysRestrictedDuty = daysRestrictedDuty;
    this.oshaRecordable = oshaRecordable;
    this.createdAt = Instant.now();
  }

  /** Sets the near-miss analysis attributes. */
  public SafetyIncident describe(
      String location, IncidentSeverity potentialSeverity, String rootCauseCategory) {
    this.location = location;
    this.potentialSeverity = potentialSeverity;
    this.rootCauseCategory = rootCauseCategory;
    return this;
  }

  public void softDelete() {
    this.deletedAt = Instant.now();
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

  public IncidentSeverity getSeverity() {
    return severity;
  }

  public LocalDate getIncidentDate() {
    return incidentDate;
  }

  public int getDaysAwayFromWork() {
    return daysAwayFromWork;
  }

  public int getDaysRestrictedDuty() {
    return daysRestrictedDuty;
  }

  public boolean isOshaRecordable() {
    return oshaRecordable;
  }

  public String getLocation() {
    return location;
  }

  public IncidentSeverity getPotentialSeverity() {
    return potentialSeverity;
  }

  public String getRootCauseCategory() {
    return rootCauseCategory;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
