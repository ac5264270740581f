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
 * Company member as seen by approval routing. Rows are owned by the user directory; this service
 * only reads them, so there are no mutators beyond soft delete.
 */
@Entity
@Table(name = "members")
public class Member {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false)
  private UUID companyId;

  @Column(name = "email", nullable = false)
  private String email;

  @Column(name = "name")
  private String name;

  @Column(name = "default_role", nullable = false, length = 50)
  private String defaultRole;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Member() {}

  public Member(UUID companyId, String email, String name, String defaultRole) {
    this.companyId = companyId;
    this.email = email;
    this.name = name;
    this.defaultRole = defaultRole;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public String getEmail() {
    return email;
  }

  public String getName() {
    return name;
  }

  public String getDefaultRole() {
    return defaultRole;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public boolean isDeleted() {
    return deletedAt != null;
  }

  public void softDelete() {
    this.deletedAt = Instant.now();
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
