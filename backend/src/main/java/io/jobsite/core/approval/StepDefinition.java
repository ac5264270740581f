package io.jobsite.core.approval;

import java.util.List;
import java.util.UUID;

/** Step as supplied when a workflow is created, before its approver fields are validated. */
public record StepDefinition(
    int stepOrder,
    String name,
    String approverType,
    List<UUID> approverIds,
    String approverRole,
    UUID approverCustomRoleId) {

  ApproverSpec toSpec() {
    return ApproverSpec.of(approverType, approverIds, approverRole, approverCustomRoleId);
  }
}
