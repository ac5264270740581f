package io.jobsite.core.nearmiss;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.jobsite.core.exception.InvalidStateException;
import io.jobsite.core.safety.IncidentSeverity;
import io.jobsite.core.safety.SafetyIncident;
import io.jobsite.core.safety.SafetyIncidentRepository;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NearMissAnalyticsServiceTest {

  private static final UUID COMPANY_ID = UUID.randomUUID();
  private static final UUID PROJECT_ID = UUID.randomUUID();
  private static final LocalDate AS_OF = LocalDate.of(2025, 6, 30);
  private static final LocalDate WINDOW_START = LocalDate.of(2025, 6, 1);

  @Mock private SafetyIncidentRepository incidentRepository;

  private NearMissAnalyticsService service;

  @BeforeEach
  void setUp() {
    service = new NearMissAnalyticsService(incidentRepository);
  }

  @Test
  void detectFrequencySpikes_flagsOnlyTheOutlierDay() {
    var incidents = new ArrayList<SafetyIncident>();
    // one near miss on each odd day of June, eight on the 20th
    for (int d = 0; d < 30; d += 2) {
      incidents.add(nearMiss(WINDOW_START.plusDays(d)));
    }
    var spikeDay = LocalDate.of(2025, 6, 20);
    for (int i = 0; i < 8; i++) {
      incidents.add(nearMiss(spikeDay));
    }
    when(incidentRepository.findNearMissesInPeriod(COMPANY_ID, PROJECT_ID, WINDOW_START, AS_OF))
        .thenReturn(incidents);

    var spikes = service.detectFrequencySpikes(COMPANY_ID, PROJECT_ID, 30, 2.0, AS_OF);

    assertThat(spikes).hasSize(1);
    var spike = spikes.get(0);
    assertThat(spike.date()).isEqualTo(spikeDay);
    assertThat(spike.count()).isEqualTo(8);
    assertThat(spike.average()).isEqualByComparingTo("0.77");
    assertThat(spike.deviationScore().doubleValue()).isGreaterThan(2.0);
  }

  @Test
  void detectFrequencySpikes_zeroVariance_flagsNothing() {
    var incidents = new ArrayList<SafetyIncident>();
    for (int d = 0; d < 30; d++) {
      incidents.add(nearMiss(WINDOW_START.plusDays(d)));
    }
    when(incidentRepository.findNearMissesInPeriod(COMPANY_ID, PROJECT_ID, WINDOW_START, AS_OF))
        .thenReturn(incidents);

    assertThat(service.detectFrequencySpikes(COMPANY_ID, PROJECT_ID, 30, 2.0, AS_OF)).isEmpty();
  }

  @Test
  void detectFrequencySpikes_noNearMisses_flagsNothing() {
    when(incidentRepository.findNearMissesInPeriod(COMPANY_ID, null, WINDOW_START, AS_OF))
        .thenReturn(List.of());

    assertThat(service.detectFrequencySpikes(COMPANY_ID, null, 30, 2.0, AS_OF)).isEmpty();
  }

  @Test
  void detectFrequencySpikes_lookbackBelowTwo_isRejected() {
    assertThatThrownBy(() -> service.detectFrequencySpikes(COMPANY_ID, null, 1, 2.0, AS_OF))
        .isInstanceOf(InvalidStateException.class);
    verifyNoInteractions(incidentRepository);
  }

  @Test
  void detectFrequencySpikes_lookbackAboveOneYear_isRejectedBeforeQuerying() {
    assertThatThrownBy(
            () -> service.detectFrequencySpikes(COMPANY_ID, null, 40_000_000, 2.0, AS_OF))
        .isInstanceOf(InvalidStateException.class);
    verifyNoInteractions(incidentRepository);
  }

  @Test
  void detectFrequencySpikes_lookbackOfOneYear_isAccepted() {
    var start = AS_OF.minusDays(NearMissAnalyticsService.MAX_WINDOW_DAYS - 1L);
    when(incidentRepository.findNearMissesInPeriod(COMPANY_ID, null, start, AS_OF))
        .thenReturn(List.of());

    assertThat(
            service.detectFrequencySpikes(
                COMPANY_ID, null, NearMissAnalyticsService.MAX_WINDOW_DAYS, 2.0, AS_OF))
        .isEmpty();
  }

  @Test
  void detectLocationHotspots_daysOutsideOneYear_isRejected() {
    assertThatThrownBy(() -> service.detectLocationHotspots(COMPANY_ID, null, 3, 367, AS_OF))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> service.detectLocationHotspots(COMPANY_ID, null, 3, 0, AS_OF))
        .isInstanceOf(InvalidStateException.class);
    verifyNoInteractions(incidentRepository);
  }

  @Test
  void calculateTrend_periodOutsideOneYear_isRejected() {
    assertThatThrownBy(() -> service.calculateTrend(COMPANY_ID, null, 367, AS_OF))
        .isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> service.calculateTrend(COMPANY_ID, null, 0, AS_OF))
        .isInstanceOf(InvalidStateException.class);
    verifyNoInteractions(incidentRepository);
  }

  @Test
  void detectFrequencySpikes_negativeThreshold_isRejected() {
    assertThatThrownBy(() -> service.detectFrequencySpikes(COMPANY_ID, null, 30, -1.0, AS_OF))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void detectLocationHotspots_ranksByRiskAndSkipsSparseLocations() {
    var day = AS_OF.minusDays(10);
    var incidents =
        List.of(
            nearMiss(day).describe("Level 3 deck", IncidentSeverity.FATALITY, "fall"),
            nearMiss(day).describe("Level 3 deck", IncidentSeverity.LOST_TIME, null),
            nearMiss(day).describe("Level 3 deck", null, "housekeeping"),
            nearMiss(day).describe("Gate B", IncidentSeverity.MEDICAL_TREATMENT, "traffic"),
            nearMiss(day).describe("Gate B", IncidentSeverity.MEDICAL_TREATMENT, "traffic"),
            nearMiss(day).describe("Gate B", IncidentSeverity.MEDICAL_TREATMENT, null),
            nearMiss(day).describe("Gate B", IncidentSeverity.MEDICAL_TREATMENT, "signage"),
            nearMiss(day),
            nearMiss(day),
            nearMiss(day),
            nearMiss(day).describe("Crane pad", IncidentSeverity.FATALITY, "rigging"));
    when(incidentRepository.findNearMissesInPeriod(
            COMPANY_ID, PROJECT_ID, AS_OF.minusDays(90), AS_OF))
        .thenReturn(incidents);

    var hotspots = service.detectLocationHotspots(COMPANY_ID, PROJECT_ID, 3, 90, AS_OF);

    assertThat(hotspots)
        .extracting(LocationHotspot::location)
        .containsExactly("Level 3 deck", "Gate B", "Unknown");
    var deck = hotspots.get(0);
    assertThat(deck.incidentCount()).isEqualTo(3);
    assertThat(deck.highSeverityCount()).isEqualTo(2);
    assertThat(deck.riskScore()).isEqualByComparingTo("11.00");
    assertThat(deck.rootCauses()).containsExactly("fall", "housekeeping");
    var gate = hotspots.get(1);
    assertThat(gate.riskScore()).isEqualByComparingTo("10.00");
    assertThat(gate.highSeverityCount()).isZero();
    assertThat(gate.rootCauses()).containsExactly("signage", "traffic");
    assertThat(hotspots.get(2).riskScore()).isEqualByComparingTo("3.00");
  }

  @Test
  void calculateTrend_comparesAgainstPreviousPeriod() {
    var incidents =
        List.of(
            nearMiss(LocalDate.of(2025, 5, 1)),
            nearMiss(LocalDate.of(2025, 5, 30)),
            nearMiss(LocalDate.of(2025, 5, 31)).describe("Yard", null, "fall"),
            nearMiss(LocalDate.of(2025, 6, 10)),
            nearMiss(LocalDate.of(2025, 6, 30)).describe("Yard", null, "fall"));
    when(incidentRepository.findNearMissesInPeriod(
            COMPANY_ID, null, LocalDate.of(2025, 5, 1), AS_OF))
        .thenReturn(incidents);

    var trend = service.calculateTrend(COMPANY_ID, null, 30, AS_OF);

    assertThat(trend.currentStart()).isEqualTo(LocalDate.of(2025, 5, 31));
    assertThat(trend.currentPeriodCount()).isEqualTo(3);
    assertThat(trend.previousPeriodCount()).isEqualTo(2);
    assertThat(trend.changePercentage()).isEqualByComparingTo("50.00");
    assertThat(trend.direction()).isEqualTo(TrendDirection.INCREASING);
    assertThat(trend.byRootCause()).containsExactly(entry("fall", 2), entry("unknown", 1));
  }

  @Test
  void calculateTrend_emptyPreviousPeriod_reportsZeroChange() {
    when(incidentRepository.findNearMissesInPeriod(
            COMPANY_ID, PROJECT_ID, LocalDate.of(2025, 6, 16), AS_OF))
        .thenReturn(List.of(nearMiss(AS_OF)));

    var trend = service.calculateTrend(COMPANY_ID, PROJECT_ID, 7, AS_OF);

    assertThat(trend.previousPeriodCount()).isZero();
    assertThat(trend.changePercentage()).isEqualByComparingTo("0");
    assertThat(trend.direction()).isEqualTo(TrendDirection.INCREASING);
  }

  @Test
  void calculateTrend_noNearMisses_isStable() {
    when(incidentRepository.findNearMissesInPeriod(
            COMPANY_ID, PROJECT_ID, LocalDate.of(2025, 6, 16), AS_OF))
        .thenReturn(List.of());

    var trend = service.calculateTrend(COMPANY_ID, PROJECT_ID, 7, AS_OF);

    assertThat(trend.direction()).isEqualTo(TrendDirection.STABLE);
    assertThat(trend.byRootCause()).isEmpty();
  }

  private static SafetyIncident nearMiss(LocalDate date) {
    return new SafetyIncident(
        COMPANY_ID, PROJECT_ID, IncidentSeverity.NEAR_MISS, date, 0, 0, false);
  }
}
