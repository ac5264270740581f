package io.jobsite.core.approval;

import java.util.Map;
import java.util.Set;

/** Approval request lifecycle. Only PENDING has outgoing transitions. */
public enum ApprovalStatus {
  PENDING,
  APPROVED,
  REJECTED,
  CANCELLED;

  private static final Map<ApprovalStatus, Set<ApprovalStatus>> ALLOWED_TRANSITIONS =
      Map.of(PENDING, Set.of(APPROVED, REJECTED, CANCELLED));

  public boolean canTransitionTo(ApprovalStatus target) {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
  }
}
