package io.jobsite.core.approval;

import io.jobsite.core.exception.InvalidStateException;
import java.util.List;
import java.util.UUID;

/**
 * Who may act on a workflow step. Built from the step's columns; exactly the column matching the
 * approver type is read and the others are ignored.
 */
public sealed interface ApproverSpec
    permits ApproverSpec.UserList,
        ApproverSpec.DefaultRole,
        ApproverSpec.CustomRole,
        ApproverSpec.AnyMember {

  ApproverType type();

  /** Literal list of member ids. */
  record UserList(List<UUID> memberIds) implements ApproverSpec {
    public UserList {
      memberIds = List.copyOf(memberIds);
    }

    @Override
    public ApproverType type() {
      return ApproverType.USER;
    }
  }

  /** Project members whose default role equals {@code roleCode} exactly. */
  record DefaultRole(String roleCode) implements ApproverSpec {
    @Override
    public ApproverType type() {
      return ApproverType.ROLE;
    }
  }

  /** Holders of a company-defined custom role, globally or within the project. */
  record CustomRole(UUID customRoleId) implements ApproverSpec {
    @Override
    public ApproverType type() {
      return ApproverType.CUSTOM_ROLE;
    }
  }

  /** Any member of the project. */
  record AnyMember() implements ApproverSpec {
    @Override
    public ApproverType type() {
      return ApproverType.ANY;
    }
  }

  static ApproverSpec fromStep(ApprovalStep step) {
    return of(
        step.getApproverType(),
        step.getApproverIds(),
        step.getApproverRole(),
        step.getApproverCustomRoleId());
  }

  /**
   * Validates and builds a spec. Throws {@link InvalidStateException} for an unknown type code or
   * when the field the type needs is missing.
   */
  static ApproverSpec of(
      String typeCode, List<UUID> approverIds, String approverRole, UUID customRoleId) {
    ApproverType type = ApproverType.fromCode(typeCode);
    return switch (type) {
      case USER -> {
        if (approverIds == null || approverIds.isEmpty()) {
          throw missing(type, "approverIds");
        }
        yield new UserList(approverIds);
      }
      case ROLE -> {
        if (approverRole == null || approverRole.isBlank()) {
          throw missing(type, "approverRole");
        }
        yield new DefaultRole(approverRole);
      }
      case CUSTOM_ROLE -> {
        if (customRoleId == null) {
          throw missing(type, "approverCustomRoleId");
        }
        yield new CustomRole(customRoleId);
      }
      case ANY -> new AnyMember();
    };
  }

  private static InvalidStateException missing(ApproverType type, String field) {
    return new InvalidStateException(
        "Invalid approver configuration",
        "Approver type '" + type.code() + "' requires " + field);
  }
}
