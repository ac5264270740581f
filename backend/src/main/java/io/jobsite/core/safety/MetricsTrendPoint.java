package io.jobsite.core.safety;

import java.math.BigDecimal;
import java.time.LocalDate;

public record MetricsTrendPoint(
    String periodLabel,
    LocalDate periodDate,
    BigDecimal trir,
    BigDecimal dart,
    BigDecimal ltir,
    BigDecimal severityRate,
    int totalRecordableCases,
    BigDecimal hoursWorked,
    BigDecimal industryAvgTrir) {

  public static MetricsTrendPoint from(SafetyMetricsSnapshot snapshot) {
    return new MetricsTrendPoint(
        snapshot.periodLabel(),
        snapshot.getSnapshotDate(),
        snapshot.getTrir(),
        snapshot.getDart(),
        snapshot.getLtir(),
        snapshot.getSeverityRate(),
        snapshot.getTotalRecordableCases(),
        snapshot.getTotalHoursWorked(),
        snapshot.getIndustryAvgTrir());
  }
}
