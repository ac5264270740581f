package io.jobsite.core.nearmiss;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A day whose near-miss count stood out from the window.
 *
 * @param average mean daily count over the window
 * @param stdDev sample standard deviation of the daily counts
 * @param deviationScore {@code (count - average) / stdDev}
 */
public record SpikeDay(
    LocalDate date, int count, BigDecimal average, BigDecimal stdDev, BigDecimal deviationScore) {}
