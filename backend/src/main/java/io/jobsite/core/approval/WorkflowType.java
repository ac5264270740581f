package io.jobsite.core.approval;

public enum WorkflowType {
  DOCUMENT,
  SUBMITTAL,
  RFI,
  CHANGE_ORDER
}
