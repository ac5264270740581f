package io.jobsite.core.approval;

import io.jobsite.core.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

/**
 * A document, submittal, RFI or change order travelling through a workflow. {@code currentStep}
 * only ever increases and a request never leaves a terminal status.
 */
@Entity
@Table(name = "approval_requests")
public class ApprovalRequest {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "workflow_id", nullable = false)
  private UUID workflowId;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "entity_type", nullable = false, length = 50)
  private String entityType;

  @Column(name = "entity_id", nullable = false)
  private UUID entityId;

  @Column(name = "current_step", nullable = false)
  private int currentStep;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ApprovalStatus status;

  @Column(name = "initiated_by", nullable = false)
  private UUID initiatedBy;

  @Column(name = "initiated_at", nullable = false, updatable = false)
  private Instant initiatedAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ApprovalRequest() {}

  public ApprovalRequest(
      UUID workflowId, UUID projectId, String entityType, UUID entityId, UUID initiatedBy) {
    this.workflowId = workflowId;
    this.projectId = projectId;
    this.entityType = entityType;
    this.entityId = entityId;
    this.initiatedBy = initiatedBy;
    this.currentStep = 1;
    this.status = ApprovalStatus.PENDING;
    this.initiatedAt = Instant.now();
    this.updatedAt = this.initiatedAt;
  }

  /**
   * Records an approval of the current step. On the last step the request becomes APPROVED,
   * otherwise it moves to the next step and stays PENDING.
   */
  public void approveCurrentStep(boolean lastStep) {
    if (lastStep) {
      requireTransition(ApprovalStatus.APPROVED, "approve");
      this.status = ApprovalStatus.APPROVED;
      this.completedAt = Instant.now();
    } else {
      requirePending("advance");
      this.currentStep = this.currentStep + 1;
    }
    this.updatedAt = Instant.now();
  }

  public void reject() {
    requireTransition(ApprovalStatus.REJECTED, "reject");
    this.status = ApprovalStatus.REJECTED;
    this.completedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void cancel() {
    requireTransition(ApprovalStatus.CANCELLED, "cancel");
    this.status = ApprovalStatus.CANCELLED;
    this.completedAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public boolean isPending() {
    return status == ApprovalStatus.PENDING;
  }

  private void requirePending(String action) {
    if (status != ApprovalStatus.PENDING) {
      throw new InvalidStateException(
          "Invalid approval request state", "Cannot " + action + " request in status " + status);
    }
  }

  private void requireTransition(ApprovalStatus target, String action) {
    if (!this.status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid approval request state",
          "Cannot " + action + " request in status " + this.status);
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getWorkflowId() {
    return workflowId;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public String getEntityType() {
    return entityType;
  }

  public UUID getEntityId() {
    return entityId;
  }

  public int getCurrentStep() {
    return currentStep;
  }

  public ApprovalStatus getStatus() {
    return status;
  }

  public UUID getInitiatedBy() {
    return initiatedBy;
  }

  public Instant getInitiatedAt() {
    return initiatedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public int getVersion() {
    return version;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
