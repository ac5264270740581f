package io.jobsite.core.approval;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Append-only trail entry. No setters. */
@Entity
@Table(name = "approval_actions")
public class ApprovalAction {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "request_id", nullable = false, updatable = false)
  private UUID requestId;

  @Column(name = "step_order", nullable = false, updatable = false)
  private int stepOrder;

  @Enumerated(EnumType.STRING)
  @Column(name = "action", nullable = false, length = 20, updatable = false)
  private ApprovalActionType action;

  @Column(name = "actor_id", nullable = false, updatable = false)
  private UUID actorId;

  @Column(name = "notes", columnDefinition = "TEXT", updatable = false)
  private String notes;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ApprovalAction() {}

  public ApprovalAction(
      UUID requestId, int stepOrder, ApprovalActionType action, UUID actorId, String notes) {
    this.requestId = requestId;
    this.stepOrder = stepOrder;
    this.action = action;
    this.actorId = actorId;
    this.notes = notes;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getRequestId() {
    return requestId;
  }

  public int getStepOrder() {
    return stepOrder;
  }

  public ApprovalActionType getAction() {
    return action;
  }

  public UUID getActorId() {
    return actorId;
  }

  public String getNotes() {
    return notes;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
