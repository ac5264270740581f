package io.jobsite.core.approval;

import java.util.UUID;

/** State of a request after an action was applied. */
public record AdvanceResult(UUID requestId, ApprovalStatus status, int currentStep) {

  static AdvanceResult of(ApprovalRequest request) {
    return new AdvanceResult(request.getId(), request.getStatus(), request.getCurrentStep());
  }
}
