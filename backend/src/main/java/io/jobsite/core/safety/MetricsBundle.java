package io.jobsite.core.safety;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Counts and OSHA rates for one scope over [start, end]. Rates are null when no hours were
 * reported for the period.
 */
public record MetricsBundle(
    LocalDate start,
    LocalDate end,
    BigDecimal totalHoursWorked,
    int averageEmployees,
    int recordableCases,
    int fatalities,
    int daysAwayCases,
    int restrictedCases,
    int dartCases,
    int lostTimeCases,
    int seriousCases,
    int otherRecordableCases,
    int totalDaysAway,
    int totalDaysRestricted,
    BigDecimal trir,
    BigDecimal dart,
    BigDecimal ltir,
    BigDecimal severityRate) {

  /**
   * Aggregates already-filtered incidents and hours rows. A DART case is an incident with days
   * away or restricted days, counted once even when it has both.
   */
  public static MetricsBundle compute(
      LocalDate start,
      LocalDate end,
      List<SafetyIncident> incidents,
      List<EmployeeHoursWorked> hours) {
    BigDecimal totalHours =
        hours.stream()
            .map(EmployeeHoursWorked::getTotalHours)
            .filter(Objects::nonNull)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

    var headcounts =
        hours.stream()
            .map(EmployeeHoursWorked::getAverageEmployees)
            .filter(Objects::nonNull)
            .toList();
    int averageEmployees = 0;
    if (!headcounts.isEmpty()) {
      long sum = headcounts.stream().mapToLong(Integer::longValue).sum();
      averageEmployees =
          BigDecimal.valueOf(sum)
              .divide(BigDecimal.valueOf(headcounts.size()), 0, RoundingMode.HALF_UP)
              .intValue();
    }

    int recordable = 0;
    int fatalities = 0;
    int daysAwayCases = 0;
    int restrictedCases = 0;
    int dartCases = 0;
    int lostTime = 0;
    int serious = 0;
    int otherRecordable = 0;
    int totalDaysAway = 0;
    int totalDaysRestricted = 0;

    for (SafetyIncident incident : incidents) {
      IncidentSeverity severity = incident.getSeverity();
      boolean away = incident.getDaysAwayFromWork() > 0;
      boolean restricted = incident.getDaysRestrictedDuty() > 0;

      if (incident.isOshaRecordable()) {
        recordable++;
        if (severity != IncidentSeverity.FATALITY
            && severity != IncidentSeverity.LOST_TIME
            && !away
            && !restricted) {
          otherRecordable++;
        }
      }
      if (severity == IncidentSeverity.FATALITY) {
        fatalities++;
      }
      if (severity == IncidentSeverity.LOST_TIME) {
        lostTime++;
      }
      if (severity.isSerious()) {
        serious++;
      }
      if (away) {
        daysAwayCases++;
      }
      if (restricted) {
        restrictedCases++;
      }
      if (away || restricted) {
        dartCases++;
      }
      totalDaysAway += incident.getDaysAwayFromWork();
      totalDaysRestricted += incident.getDaysRestrictedDuty();
    }

    return new MetricsBundle(
        start,
        end,
        totalHours,
        averageEmployees,
        recordable,
        fatalities,
        daysAwayCases,
        restrictedCases,
        dartCases,
        lostTime,
        serious,
        otherRecordable,
        totalDaysAway,
        totalDaysRestricted,
        OshaRates.compute(RateKind.TRIR, recordable, totalHours).orElse(null),
        OshaRates.compute(RateKind.DART, dartCases, totalHours).orElse(null),
        OshaRates.compute(RateKind.LTIR, lostTime, totalHours).orElse(null),
        OshaRates.severity(totalDaysAway, totalDaysRestricted, totalHours).orElse(null));
  }
}
