package io.jobsite.core.approval;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One ordered step of a workflow. {@code approverType} is kept as its raw code so that {@link
 * ApproverSpec#fromStep(ApprovalStep)} can reject values it does not recognise.
 */
@Entity
@Table(name = "approval_steps")
public class ApprovalStep {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "workflow_id", nullable = false)
  private UUID workflowId;

  @Column(name = "step_order", nullable = false)
  private int stepOrder;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "approver_type", nullable = false, length = 20)
  private String approverType;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "approver_ids", columnDefinition = "jsonb")
  private List<UUID> approverIds = new ArrayList<>();

  @Column(name = "approver_role", length = 50)
  private String approverRole;

  @Column(name = "approver_custom_role_id")
  private UUID approverCustomRoleId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ApprovalStep() {}

  public ApprovalStep(UUID workflowId, int stepOrder, String name, ApproverSpec spec) {
    this.workflowId = workflowId;
    this.stepOrder = stepOrder;
    this.name = name;
    this.approverType = spec.type().code();
    if (spec instanceof ApproverSpec.UserList users) {
      this.approverIds = new ArrayList<>(users.memberIds());
    } else if (spec instanceof ApproverSpec.DefaultRole role) {
      this.approverRole = role.roleCode();
    } else if (spec instanceof ApproverSpec.CustomRole customRole) {
      this.approverCustomRoleId = customRole.customRoleId();
    }
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getWorkflowId() {
    return workflowId;
  }

  public int getStepOrder() {
    return stepOrder;
  }

  public String getName() {
    return name;
  }

  public String getApproverType() {
    return approverType;
  }

  public List<UUID> getApproverIds() {
    return approverIds;
  }

  public String getApproverRole() {
    return approverRole;
  }

  public UUID getApproverCustomRoleId() {
    return approverCustomRoleId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
