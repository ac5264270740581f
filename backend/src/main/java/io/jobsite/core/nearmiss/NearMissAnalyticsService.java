package io.jobsite.core.nearmiss;

import io.jobsite.core.exception.InvalidStateException;
import io.jobsite.core.safety.IncidentSeverity;
import io.jobsite.core.safety.SafetyIncident;
import io.jobsite.core.safety.SafetyIncidentRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Pattern detection over live near-miss incidents. All windows end at and include {@code asOf}. */
@Service
@Transactional(readOnly = true)
public class NearMissAnalyticsService {

  private static final Logger log = LoggerFactory.getLogger(NearMissAnalyticsService.class);

  static final String UNKNOWN_LOCATION = "Unknown";
  static final String UNKNOWN_ROOT_CAUSE = "unknown";

  /** Longest window, in days, any analysis may cover. */
  public static final int MAX_WINDOW_DAYS = 366;

  private final SafetyIncidentRepository incidentRepository;

  public NearMissAnalyticsService(SafetyIncidentRepository incidentRepository) {
    this.incidentRepository = incidentRepository;
  }

  /**
   * Days in the {@code lookbackDays}-day window whose count exceeds {@code mean + k * stddev}.
   * Days without near misses count as zero. Newest first; nothing is flagged when every day has
   * the same count.
   */
  public List<SpikeDay> detectFrequencySpikes(
      UUID companyId, UUID projectId, int lookbackDays, double k, LocalDate asOf) {
    if (lookbackDays < 2 || lookbackDays > MAX_WINDOW_DAYS) {
      throw new InvalidStateException(
          "Invalid lookback",
          "lookbackDays must be between 2 and " + MAX_WINDOW_DAYS + ": " + lookbackDays);
    }
    if (k < 0 || Double.isNaN(k)) {
      throw new InvalidStateException("Invalid threshold", "k must not be negative: " + k);
    }

    LocalDate start = asOf.minusDays(lookbackDays - 1L);
    var incidents = incidentRepository.findNearMissesInPeriod(companyId, projectId, start, asOf);

    Map<LocalDate, Integer> daily = new TreeMap<>();
    for (LocalDate day = start; !day.isAfter(asOf); day = day.plusDays(1)) {
      daily.put(day, 0);
    }
    for (SafetyIncident incident : incidents) {
      daily.merge(incident.getIncidentDate(), 1, Integer::sum);
    }

    int n = daily.size();
    double mean = daily.values().stream().mapToInt(Integer::intValue).average().orElse(0);
    double squares = daily.values().stream().mapToDouble(c -> (c - mean) * (c - mean)).sum();
    double stdDev = n > 1 ? Math.sqrt(squares / (n - 1)) : 0;
    if (stdDev == 0) {
      return List.of();
    }

    double threshold = mean + k * stdDev;
    var spikes = new ArrayList<SpikeDay>();
    daily.forEach(
        (day, count) -> {
          if (count > threshold) {
            spikes.add(
                new SpikeDay(
                    day,
                    count,
                    round(mean),
                    round(stdDev),
                    round((count - mean) / stdDev)));
          }
        });
    spikes.sort(Comparator.comparing(SpikeDay::date).reversed());

    log.debug(
        "Spike detection for company {} project {}: {} days, mean={}, sd={}, {} spikes",
        companyId,
        projectId,
        n,
        mean,
        stdDev,
        spikes.size());
    return spikes;
  }

  /**
   * Locations with at least {@code minIncidents} near misses in the last {@code days} days,
   * highest risk first.
   */
  public List<LocationHotspot> detectLocationHotspots(
      UUID companyId, UUID projectId, int minIncidents, int days, LocalDate asOf) {
    if (days < 1 || days > MAX_WINDOW_DAYS) {
      throw new InvalidStateException(
          "Invalid window", "days must be between 1 and " + MAX_WINDOW_DAYS + ": " + days);
    }
    var incidents =
        incidentRepository.findNearMissesInPeriod(
            companyId, projectId, asOf.minusDays(days), asOf);

    Map<String, List<SafetyIncident>> byLocation =
        incidents.stream()
            .collect(
                Collectors.groupingBy(
                    i -> i.getLocation() != null ? i.getLocation() : UNKNOWN_LOCATION,
                    TreeMap::new,
                    Collectors.toList()));

    return byLocation.entrySet().stream()
        .filter(e -> e.getValue().size() >= minIncidents)
        .map(e -> toHotspot(e.getKey(), e.getValue()))
        .sorted(
            Comparator.comparing(LocationHotspot::riskScore)
                .reversed()
                .thenComparing(LocationHotspot::location))
        .toList();
  }

  /**
   * Near misses in {@code [asOf - periodDays, asOf]} against {@code [asOf - 2 * periodDays, asOf
   * - periodDays)}.
   */
  public NearMissTrend calculateTrend(
      UUID companyId, UUID projectId, int periodDays, LocalDate asOf) {
    if (periodDays < 1 || periodDays > MAX_WINDOW_DAYS) {
      throw new InvalidStateException(
          "Invalid period",
          "periodDays must be between 1 and " + MAX_WINDOW_DAYS + ": " + periodDays);
    }
    LocalDate currentStart = asOf.minusDays(periodDays);
    LocalDate previousStart = currentStart.minusDays(periodDays);

    var incidents =
        incidentRepository.findNearMissesInPeriod(companyId, projectId, previousStart, asOf);

    int current = 0;
    int previous = 0;
    Map<String, Integer> byRootCause = new TreeMap<>();
    for (SafetyIncident incident : incidents) {
      if (!incident.getIncidentDate().isBefore(currentStart)) {
        current++;
        String cause =
            incident.getRootCauseCategory() != null
                ? incident.getRootCauseCategory()
                : UNKNOWN_ROOT_CAUSE;
        byRootCause.merge(cause, 1, Integer::sum);
      } else {
        previous++;
      }
    }

    BigDecimal change =
        previous == 0
            ? BigDecimal.ZERO
            : BigDecimal.valueOf(current - previous)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(previous), 2, RoundingMode.HALF_UP);

    TrendDirection direction =
        current > previous
            ? TrendDirection.INCREASING
            : current < previous ? TrendDirection.DECREASING : TrendDirection.STABLE;

    return new NearMissTrend(
        currentStart,
        asOf,
        current,
        previous,
        change,
        direction,
        new LinkedHashMap<>(byRootCause));
  }

  private static LocationHotspot toHotspot(String location, List<SafetyIncident> incidents) {
    int fatal = countPotential(incidents, IncidentSeverity.FATALITY);
    int lostTime = countPotential(incidents, IncidentSeverity.LOST_TIME);
    int medical = countPotential(incidents, IncidentSeverity.MEDICAL_TREATMENT);

    BigDecimal risk =
        BigDecimal.valueOf(incidents.size())
            .add(BigDecimal.valueOf(5L * fatal))
            .add(BigDecimal.valueOf(3L * lostTime))
            .add(new BigDecimal("1.5").multiply(BigDecimal.valueOf(medical)))
            .setScale(2, RoundingMode.HALF_UP);

    List<String> rootCauses =
        incidents.stream()
            .map(SafetyIncident::getRootCauseCategory)
            .filter(Objects::nonNull)
            .distinct()
            .sorted()
            .toList();

    return new LocationHotspot(location, incidents.size(), fatal + lostTime, risk, rootCauses);
  }

  private static int countPotential(List<SafetyIncident> incidents, IncidentSeverity severity) {
    return (int) incidents.stream().filter(i -> i.getPotentialSeverity() == severity).count();
  }

  private static BigDecimal round(double value) {
    return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
  }
}
