package io.jobsite.core.safety;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.jobsite.core.exception.InvalidStateException;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class ReportingPeriodTest {

  private static final LocalDate TODAY = LocalDate.of(2025, 5, 14);

  @Test
  void of_monthly_coversWholeMonthAndDropsQuarter() {
    var period = ReportingPeriod.of(PeriodType.MONTHLY, 2024, 2, 3, TODAY);

    assertThat(period.start()).isEqualTo(LocalDate.of(2024, 2, 1));
    assertThat(period.end()).isEqualTo(LocalDate.of(2024, 2, 29));
    assertThat(period.month()).isEqualTo(2);
    assertThat(period.quarter()).isNull();
    assertThat(period.label()).isEqualTo("Feb 2024");
  }

  @Test
  void of_monthlyWithoutMonth_usesCurrentMonth() {
    var period = ReportingPeriod.of(PeriodType.MONTHLY, 2025, null, null, TODAY);

    assertThat(period.month()).isEqualTo(5);
    assertThat(period.end()).isEqualTo(LocalDate.of(2025, 5, 31));
  }

  @Test
  void of_quarterly_coversThreeMonths() {
    var period = ReportingPeriod.of(PeriodType.QUARTERLY, 2025, 7, 4, TODAY);

    assertThat(period.start()).isEqualTo(LocalDate.of(2025, 10, 1));
    assertThat(period.end()).isEqualTo(LocalDate.of(2025, 12, 31));
    assertThat(period.month()).isNull();
    assertThat(period.label()).isEqualTo("Q4 2025");
  }

  @Test
  void of_quarterlyWithoutQuarter_usesCurrentQuarter() {
    var period = ReportingPeriod.of(PeriodType.QUARTERLY, 2025, null, null, TODAY);

    assertThat(period.quarter()).isEqualTo(2);
    assertThat(period.start()).isEqualTo(LocalDate.of(2025, 4, 1));
    assertThat(period.end()).isEqualTo(LocalDate.of(2025, 6, 30));
  }

  @Test
  void of_yearly_coversCalendarYear() {
    var period = ReportingPeriod.of(PeriodType.YEARLY, 2023, 4, 2, TODAY);

    assertThat(period.start()).isEqualTo(LocalDate.of(2023, 1, 1));
    assertThat(period.end()).isEqualTo(LocalDate.of(2023, 12, 31));
    assertThat(period.month()).isNull();
    assertThat(period.quarter()).isNull();
    assertThat(period.label()).isEqualTo("2023");
  }

  @Test
  void of_ytdForCurrentYear_endsToday() {
    var period = ReportingPeriod.of(PeriodType.YTD, 2025, null, null, TODAY);

    assertThat(period.start()).isEqualTo(LocalDate.of(2025, 1, 1));
    assertThat(period.end()).isEqualTo(TODAY);
  }

  @Test
  void of_ytdForPastYear_endsOnDecember31() {
    var period = ReportingPeriod.of(PeriodType.YTD, 2024, null, null, TODAY);

    assertThat(period.end()).isEqualTo(LocalDate.of(2024, 12, 31));
  }

  @Test
  void of_ytdForFutureYear_isRejected() {
    assertThatThrownBy(() -> ReportingPeriod.of(PeriodType.YTD, 2026, null, null, TODAY))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void of_monthOutOfRange_isRejected() {
    assertThatThrownBy(() -> ReportingPeriod.of(PeriodType.MONTHLY, 2025, 13, null, TODAY))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void of_quarterOutOfRange_isRejected() {
    assertThatThrownBy(() -> ReportingPeriod.of(PeriodType.QUARTERLY, 2025, null, 0, TODAY))
        .isInstanceOf(InvalidStateException.class);
  }
}
