package io.jobsite.core.safety;

import io.jobsite.core.exception.InvalidStateException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Calendar range a snapshot covers. {@code month} is only set for monthly periods and {@code
 * quarter} only for quarterly ones, so each period has exactly one snapshot key.
 */
public record ReportingPeriod(
    PeriodType periodType,
    int year,
    Integer month,
    Integer quarter,
    LocalDate start,
    LocalDate end) {

  /**
   * Derives the range. A missing month or quarter defaults to the one containing {@code today};
   * a year-to-date period ends at {@code today}, or at December 31st for a past year.
   */
  public static ReportingPeriod of(
      PeriodType periodType, int year, Integer month, Integer quarter, LocalDate today) {
    if (periodType == null) {
      throw new InvalidStateException("Invalid period", "periodType is required");
    }
    if (year < 1900 || year > 9999) {
      throw new InvalidStateException("Invalid period", "year out of range: " + year);
    }
    return switch (periodType) {
      case MONTHLY -> {
        int m = month != null ? month : today.getMonthValue();
        if (m < 1 || m > 12) {
          throw new InvalidStateException("Invalid period", "month must be 1-12: " + m);
        }
        YearMonth ym = YearMonth.of(year, m);
        yield new ReportingPeriod(periodType, year, m, null, ym.atDay(1), ym.atEndOfMonth());
      }
      case QUARTERLY -> {
        int q = quarter != null ? quarter : (today.getMonthValue() - 1) / 3 + 1;
        if (q < 1 || q > 4) {
          throw new InvalidStateException("Invalid period", "quarter must be 1-4: " + q);
        }
        LocalDate start = LocalDate.of(year, (q - 1) * 3 + 1, 1);
        yield new ReportingPeriod(
            periodType, year, null, q, start, start.plusMonths(3).minusDays(1));
      }
      case YEARLY ->
          new ReportingPeriod(
              periodType, year, null, null, LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
      case YTD -> {
        LocalDate start = LocalDate.of(year, 1, 1);
        LocalDate yearEnd = LocalDate.of(year, 12, 31);
        if (today.isBefore(start)) {
          throw new InvalidStateException(
              "Invalid period", "year-to-date period for " + year + " has not started");
        }
        yield new ReportingPeriod(
            periodType, year, null, null, start, today.isAfter(yearEnd) ? yearEnd : today);
      }
    };
  }

  /** {@code Jan 2025}, {@code Q1 2025}, or {@code 2025}. */
  public static String label(PeriodType periodType, int year, Integer month, Integer quarter) {
    if (periodType == PeriodType.MONTHLY && month != null) {
      return YearMonth.of(year, month).getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH)
          + " "
          + year;
    }
    if (periodType == PeriodType.QUARTERLY && quarter != null) {
      return "Q" + quarter + " " + year;
    }
    return String.valueOf(year);
  }

  public String label() {
    return label(periodType, year, month, quarter);
  }
}
