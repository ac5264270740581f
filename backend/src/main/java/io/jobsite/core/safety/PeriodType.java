package io.jobsite.core.safety;

public enum PeriodType {
  MONTHLY,
  QUARTERLY,
  YEARLY,
  /** January 1st up to today. */
  YTD
}
