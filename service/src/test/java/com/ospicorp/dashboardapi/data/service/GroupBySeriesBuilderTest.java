package com.ospicorp.dashboardapi.data.service;

import static com.ospicorp.dashboardapi.data.service.RepartitionAxisBuilderTest.DAYS;
import static org.assertj.core.api.Assertions.assertThat;

import com.ospicorp.dashboardapi.data.model.GroupedValue;
import com.ospicorp.dashboardapi.data.model.SeriesChart;
import java.util.List;
import org.junit.jupiter.api.Test;

class GroupBySeriesBuilderTest {

  @Test
  void valuesLandOnTheirWeekday() {
    SeriesChart chart = GroupBySeriesBuilder.build(DAYS, List.of(
        new GroupedValue(0, 10d),
        new GroupedValue(6, 3.5)));

    assertThat(chart.label()).isEqualTo(DAYS);
    assertThat(chart.axeX()).isEqualTo(DAYS);
    assertThat(chart.axeY()).containsExactly(10d, 0d, 0d, 0d, 0d, 0d, 3.5);
  }

  @Test
  void keysOutsideTheCategoriesAreIgnored() {
    SeriesChart chart = GroupBySeriesBuilder.build(DAYS, List.of(
        new GroupedValue(7, 1d),
        new GroupedValue(-1, 1d),
        new GroupedValue(3, null)));

    assertThat(chart.axeY()).containsOnly(0d).hasSize(7);
  }
}
