package io.jobsite.core.member;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Assignment of a custom role to a member. A null {@code projectId} is a company-wide assignment;
 * otherwise the role only applies inside that project.
 */
@Entity
@Table(name = "member_custom_roles")
public class MemberCustomRole {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "member_id", nullable = false)
  private UUID memberId;

  @Column(name = "custom_role_id", nullable = false)
  private UUID customRoleId;

  @Column(name = "project_id")
  private UUID projectId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected MemberCustomRole() {}

  public MemberCustomRole(UUID memberId, UUID customRoleId, UUID projectId) {
    this.memberId = memberId;
    this.customRoleId = customRoleId;
    this.projectId = projectId;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getMemberId() {
    return memberId;
  }

  public UUID getCustomRoleId() {
    return customRoleId;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public boolean isGlobal() {
    return projectId == null;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
