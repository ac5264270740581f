package io.jobsite.core.safety;

import io.jobsite.core.exception.InvalidStateException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * OSHA rate arithmetic: {@code numerator * 200,000 / hours}, rounded half-up to two decimals. A
 * rate over zero (or unknown) hours is undefined and comes back empty.
 */
public final class OshaRates {

  /** 100 full-time employees working 40 hours a week for 50 weeks. */
  public static final BigDecimal BASE_HOURS = BigDecimal.valueOf(200_000);

  public static Optional<BigDecimal> compute(RateKind kind, long cases, BigDecimal hoursWorked) {
    if (kind == RateKind.SEVERITY) {
      return severity(cases, 0, hoursWorked);
    }
    requireNonNegative("cases", cases);
    return rate(cases, hoursWorked);
  }

  public static Optional<BigDecimal> severity(
      long daysAway, long daysRestricted, BigDecimal hoursWorked) {
    requireNonNegative("daysAway", daysAway);
    requireNonNegative("daysRestricted", daysRestricted);
    return rate(daysAway + daysRestricted, hoursWorked);
  }

  private static Optional<BigDecimal> rate(long numerator, BigDecimal hoursWorked) {
    if (hoursWorked == null) {
      return Optional.empty();
    }
    if (hoursWorked.signum() < 0) {
      throw new InvalidStateException(
          "Invalid hours worked", "Hours worked cannot be negative: " + hoursWorked);
    }
    if (hoursWorked.signum() == 0) {
      return Optional.empty();
    }
    return Optional.of(
        BigDecimal.valueOf(numerator)
            .multiply(BASE_HOURS)
            .divide(hoursWorked, 2, RoundingMode.HALF_UP));
  }

  private static void requireNonNegative(String name, long value) {
    if (value < 0) {
      throw new InvalidStateException(
          "Invalid rate input", name + " cannot be negative: " + value);
    }
  }

  private OshaRates() {}
}
