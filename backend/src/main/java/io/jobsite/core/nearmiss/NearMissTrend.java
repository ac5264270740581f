package io.jobsite.core.nearmiss;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

/**
 * Near-miss count for the current period against the equally long period before it.
 *
 * @param changePercentage percent change from the previous period; 0 when it had no near misses
 * @param byRootCause current-period counts keyed by root cause ({@code unknown} when missing)
 */
public record NearMissTrend(
    LocalDate currentStart,
    LocalDate asOf,
    int currentPeriodCount,
    int previousPeriodCount,
    BigDecimal changePercentage,
    TrendDirection direction,
    Map<String, Integer> byRootCause) {}
