package io.jobsite.core.approval;

import io.jobsite.core.exception.InvalidStateException;

/** How a workflow step names its approvers. Stored as the lowercase {@link #code()}. */
public enum ApproverType {
  USER("user"),
  ROLE("role"),
  CUSTOM_ROLE("custom_role"),
  ANY("any");

  private final String code;

  ApproverType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static ApproverType fromCode(String code) {
    if (code != null) {
      for (ApproverType type : values()) {
        if (type.code.equals(code)) {
          return type;
        }
      }
    }
    throw new InvalidStateException(
        "Invalid approver type", "Unknown approver type '" + code + "'");
  }
}
