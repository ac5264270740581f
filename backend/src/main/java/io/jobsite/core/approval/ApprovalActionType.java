package io.jobsite.core.approval;

public enum ApprovalActionType {
  APPROVE,
  REJECT,
  COMMENT,
  CANCEL
}
