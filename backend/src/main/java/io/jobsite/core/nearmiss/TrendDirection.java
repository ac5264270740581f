package io.jobsite.core.nearmiss;

public enum TrendDirection {
  INCREASING,
  DECREASING,
  STABLE
}
