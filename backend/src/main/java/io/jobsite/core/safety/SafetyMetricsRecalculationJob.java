package io.jobsite.core.safety;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the current and previous monthly snapshots for every company and project that has
 * reported hours in those months. A failing scope is logged and skipped.
 */
@Component
public class SafetyMetricsRecalculationJob {

  private static final Logger log = LoggerFactory.getLogger(SafetyMetricsRecalculationJob.class);

  private final EmployeeHoursWorkedRepository hoursRepository;
  private final SafetyMetricsService metricsService;
  private final SafetyMetricsProperties properties;

  public SafetyMetricsRecalculationJob(
      EmployeeHoursWorkedRepository hoursRepository,
      SafetyMetricsService metricsService,
      SafetyMetricsProperties properties) {
    this.hoursRepository = hoursRepository;
    this.metricsService = metricsService;
    this.properties = properties;
  }

  @Scheduled(cron = "${safety.metrics.recalculation-cron:0 30 1 * * *}")
  public void recalculate() {
    if (!properties.recalculationEnabled()) {
      log.debug("Safety metrics recalculation disabled");
      return;
    }
    recalculate(LocalDate.now());
  }

  /** Returns the number of snapshots written. */
  int recalculate(LocalDate today) {
    log.info("Safety metrics recalculation started for {}", today);
    YearMonth current = YearMonth.from(today);
    List<YearMonth> months = List.of(current.minusMonths(1), current);

    var scopes =
        hoursRepository.findScopesWithHoursBetween(
            months.get(0).atDay(1), current.atEndOfMonth());
    var companies = new LinkedHashSet<UUID>();
    scopes.forEach(scope -> companies.add(scope.companyId()));

    int written = 0;
    int failed = 0;
    for (YearMonth month : months) {
      for (UUID companyId : companies) {
        if (refresh(companyId, null, month, today)) {
          written++;
        } else {
          failed++;
        }
      }
      for (HoursScope scope : scopes) {
        if (refresh(scope.companyId(), scope.projectId(), month, today)) {
          written++;
        } else {
          failed++;
        }
      }
    }

    log.info(
        "Safety metrics recalculation completed: {} companies, {} projects, {} snapshots written,"
            + " {} failed",
        companies.size(),
        scopes.size(),
        written,
        failed);
    return written;
  }

  private boolean refresh(UUID companyId, UUID projectId, YearMonth month, LocalDate today) {
    try {
      metricsService.createSnapshot(
          companyId,
          projectId,
          PeriodType.MONTHLY,
          month.getYear(),
          month.getMonthValue(),
          null,
          null,
          null,
          today);
      return true;
    } catch (Exception e) {
      log.error(
          "Safety metrics recalculation: failed for company {} project {} month {}",
          companyId,
          projectId,
          month,
          e);
      return false;
    }
  }
}
