package io.jobsite.core.approval;

/** What an actor does to a request at its current step. Cancellation has its own operation. */
public enum ApprovalDecision {
  APPROVE(ApprovalActionType.APPROVE),
  REJECT(ApprovalActionType.REJECT),
  COMMENT(ApprovalActionType.COMMENT);

  private final ApprovalActionType actionType;

  ApprovalDecision(ApprovalActionType actionType) {
    this.actionType = actionType;
  }

  public ApprovalActionType actionType() {
    return actionType;
  }

  public boolean changesState() {
    return this != COMMENT;
  }
}
