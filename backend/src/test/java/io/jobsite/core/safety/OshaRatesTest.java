package io.jobsite.core.safety;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jobsite.core.exception.InvalidStateException;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class OshaRatesTest {

  @Test
  void compute_trirForThreeCasesOverHundredThousandHours_isSix() {
    assertThat(OshaRates.compute(RateKind.TRIR, 3, new BigDecimal("100000")))
        .contains(new BigDecimal("6.00"));
  }

  @Test
  void compute_roundsHalfUpToTwoDecimals() {
    // 1 * 200000 / 300000 = 0.6666...
    assertThat(OshaRates.compute(RateKind.DART, 1, new BigDecimal("300000")))
        .contains(new BigDecimal("0.67"));
    // 1 * 200000 / 160000 = 1.25 exactly
    assertThat(OshaRates.compute(RateKind.LTIR, 1, new BigDecimal("160000")))
        .contains(new BigDecimal("1.25"));
  }

  @ParameterizedTest
  @EnumSource(RateKind.class)
  void compute_zeroHours_isUndefined(RateKind kind) {
    assertThat(OshaRates.compute(kind, 2, BigDecimal.ZERO)).isEmpty();
  }

  @ParameterizedTest
  @EnumSource(RateKind.class)
  void compute_nullHours_isUndefined(RateKind kind) {
    assertThat(OshaRates.compute(kind, 2, null)).isEmpty();
  }

  @Test
  void compute_zeroCases_isZeroRate() {
    assertThat(OshaRates.compute(RateKind.TRIR, 0, new BigDecimal("50000")))
        .contains(new BigDecimal("0.00"));
  }

  @Test
  void compute_negativeCases_isRejected() {
    assertThatThrownBy(() -> OshaRates.compute(RateKind.TRIR, -1, new BigDecimal("1000")))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void compute_negativeHours_isRejected() {
    assertThatThrownBy(() -> OshaRates.compute(RateKind.TRIR, 1, new BigDecimal("-1")))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void severity_addsDaysAwayAndRestricted() {
    // (10 + 5) * 200000 / 400000 = 7.5
    assertThat(OshaRates.severity(10, 5, new BigDecimal("400000")))
        .contains(new BigDecimal("7.50"));
  }
}
