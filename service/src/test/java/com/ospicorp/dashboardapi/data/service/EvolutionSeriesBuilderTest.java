package com.ospicorp.dashboardapi.data.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.dashboardapi.data.model.CalendarLabels;
import com.ospicorp.dashboardapi.data.model.DataPoint;
import com.ospicorp.dashboardapi.data.model.SeriesChart;
import com.ospicorp.dashboardapi.data.model.enums.Frequency;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class EvolutionSeriesBuilderTest {
  private static final CalendarLabels THREE_DAYS = FrequencyCalendar.labels(Frequency.DAY,
      LocalDateTime.of(2020, 1, 1, 0, 0), LocalDateTime.of(2020, 1, 3, 23, 59, 59));

  @Test
  void missingBucketsAreZero() {
    SeriesChart chart = EvolutionSeriesBuilder.build(THREE_DAYS, Frequency.DAY,
        List.of(new DataPoint(LocalDateTime.of(2020, 1, 2, 0, 0), 5d)));

    assertThat(chart.axeX()).containsExactly("01/01/2020", "02/01/2020", "03/01/2020");
    assertThat(chart.label()).containsExactly(
        "Wednesday 01/01/2020", "Thursday 02/01/2020", "Friday 03/01/2020");
    assertThat(chart.axeY()).containsExactly(0d, 5d, 0d);
  }

  @Test
  void nullValuesBecomeZero() {
    SeriesChart chart = EvolutionSeriesBuilder.build(THREE_DAYS, Frequency.DAY,
        List.of(new DataPoint(LocalDateTime.of(2020, 1, 1, 0, 0), null)));

    assertThat(chart.axeY()).containsExactly(0d, 0d, 0d);
  }

  @Test
  void rowsOutsideTheAxisAreDropped() {
    SeriesChart chart = EvolutionSeriesBuilder.build(THREE_DAYS, Frequency.DAY, List.of(
        new DataPoint(LocalDateTime.of(2019, 12, 31, 0, 0), 7d),
        new DataPoint(LocalDateTime.of(2020, 1, 3, 0, 0), 2.5)));

    assertThat(chart.axeY()).containsExactly(0d, 0d, 2.5);
  }

  @Test
  void monthlyRowsMatchWhateverDayTheAxisStartsOn() {
    CalendarLabels months = FrequencyCalendar.labels(Frequency.MONTH,
        LocalDateTime.of(2020, 1, 15, 0, 0), LocalDateTime.of(2020, 3, 31, 23, 59, 59));

    SeriesChart chart = EvolutionSeriesBuilder.build(months, Frequency.MONTH,
        List.of(new DataPoint(LocalDateTime.of(2020, 2, 1, 0, 0), 120d)));

    assertThat(chart.axeX()).containsExactly("Jan 2020", "Feb 2020", "Mar 2020");
    assertThat(chart.axeY()).containsExactly(0d, 120d, 0d);
  }

  @Test
  void weeklyRowsOnlyMatchAnAxisStartingOnTheirMonday() {
    List<DataPoint> mondays = List.of(
        new DataPoint(LocalDateTime.of(2018, 1, 8, 0, 0), 5d),
        new DataPoint(LocalDateTime.of(2018, 1, 15, 0, 0), 6d));

    SeriesChart fromWednesday = EvolutionSeriesBuilder.build(
        FrequencyCalendar.labels(Frequency.WEEK, LocalDateTime.of(2018, 1, 3, 0, 0),
            LocalDateTime.of(2018, 1, 31, 23, 59, 59)),
        Frequency.WEEK, mondays);
    SeriesChart fromMonday = EvolutionSeriesBuilder.build(
        FrequencyCalendar.labels(Frequency.WEEK, LocalDateTime.of(2018, 1, 1, 0, 0),
            LocalDateTime.of(2018, 1, 31, 23, 59, 59)),
        Frequency.WEEK, mondays);

    assertThat(fromWednesday.axeY()).containsOnly(0d).hasSize(5);
    assertThat(fromMonday.axeX()).startsWith("01/01/2018", "08/01/2018", "15/01/2018");
    assertThat(fromMonday.axeY()).containsExactly(0d, 5d, 6d, 0d, 0d);
  }

  @Test
  void rowsConvertToCsvLines() {
    SeriesChart chart = EvolutionSeriesBuilder.build(THREE_DAYS, Frequency.DAY,
        List.of(new DataPoint(LocalDateTime.of(2020, 1, 2, 0, 0), 5d)));

    assertThat(chart.toRows()).hasSize(3);
    assertThat(chart.toRows().get(1).date()).isEqualTo("02/01/2020");
    assertThat(chart.toRows().get(1).label()).isEqualTo("Thursday 02/01/2020");
    assertThat(chart.toRows().get(1).value()).isEqualTo(5d);
  }
}
