package com.ospicorp.dashboardapi.data.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.dashboardapi.data.model.RepartitionAxes;
import com.ospicorp.dashboardapi.data.model.enums.AxisField;
import com.ospicorp.dashboardapi.data.model.enums.Frequency;
import com.ospicorp.dashboardapi.data.model.enums.RepartitionType;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class RepartitionAxisBuilderTest {
  static final List<String> DAYS =
      List.of("Mon.", "Tue.", "Wed.", "Thu.", "Fri.", "Sat.", "Sun.");

  private static final LocalDateTime START = LocalDateTime.of(2018, 1, 1, 0, 0);
  private static final LocalDateTime END = LocalDateTime.of(2018, 1, 8, 23, 59, 59);

  @Test
  void weekAxesAreWeekdaysByHours() {
    RepartitionAxes axes = RepartitionAxisBuilder.build(RepartitionType.WEEK, START, END, DAYS);

    assertThat(axes.axis().x()).isEqualTo(DAYS);
    assertThat(axes.axis().y()).hasSize(25);
    assertThat(axes.axis().y().get(0)).isEqualTo("00h");
    assertThat(axes.axis().y().get(24)).isEqualTo("24h");
    assertThat(axes.axis().year()).isNull();
    assertThat(axes.xField()).isEqualTo(AxisField.WEEK_DAY);
    assertThat(axes.yField()).isEqualTo(AxisField.HOUR);
    assertThat(axes.frequency()).isEqualTo(Frequency.HOUR);
  }

  @Test
  void horizontalYearAxesListIsoWeeksOnX() {
    RepartitionAxes axes =
        RepartitionAxisBuilder.build(RepartitionType.YEAR_HORIZONTAL, START, END, DAYS);

    assertThat(axes.axis().x()).isEqualTo(List.of(1, 2));
    assertThat(axes.axis().y()).isEqualTo(DAYS);
    assertThat(axes.axis().year()).containsExactly(2018, 2018);
    assertThat(axes.xField()).isEqualTo(AxisField.WEEK);
    assertThat(axes.yField()).isEqualTo(AxisField.WEEK_DAY);
    assertThat(axes.frequency()).isEqualTo(Frequency.DAY);
  }

  @Test
  void verticalYearAxesListIsoWeeksOnY() {
    RepartitionAxes axes =
        RepartitionAxisBuilder.build(RepartitionType.YEAR_VERTICAL, START, END, DAYS);

    assertThat(axes.axis().x()).isEqualTo(DAYS);
    assertThat(axes.axis().y()).isEqualTo(List.of(1, 2));
    assertThat(axes.axis().year()).containsExactly(2018, 2018);
  }

  @Test
  void sundayEndStillAddsAFollowingWeekBoundary() {
    RepartitionAxisBuilder.IsoWeeks weeks = RepartitionAxisBuilder.isoWeeks(START,
        LocalDateTime.of(2018, 1, 7, 23, 59, 59));

    assertThat(weeks.numbers()).containsExactly(1, 2);
  }

  @Test
  void weeksCrossingNewYearCarryTheirIsoYear() {
    RepartitionAxisBuilder.IsoWeeks weeks = RepartitionAxisBuilder.isoWeeks(
        LocalDateTime.of(2018, 12, 24, 0, 0), LocalDateTime.of(2019, 1, 2, 23, 59, 59));

    assertThat(weeks.numbers()).containsExactly(52, 1);
    assertThat(weeks.years()).containsExactly(2018, 2019);
  }

  @Test
  void requiresSevenWeekdayLabels() {
    assertThatThrownBy(() -> RepartitionAxisBuilder.build(RepartitionType.WEEK, START, END,
        List.of("Mon.")))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
