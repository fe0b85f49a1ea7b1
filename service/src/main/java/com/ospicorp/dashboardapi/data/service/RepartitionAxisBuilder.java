package com.ospicorp.dashboardapi.data.service;

import com.ospicorp.dashboardapi.data.model.Axis;
import com.ospicorp.dashboardapi.data.model.RepartitionAxes;
import com.ospicorp.dashboardapi.data.model.enums.AxisField;
import com.ospicorp.dashboardapi.data.model.enums.Frequency;
import com.ospicorp.dashboardapi.data.model.enums.RepartitionType;
import java.time.LocalDateTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;

public final class RepartitionAxisBuilder {
  static final int HOURS_PER_DAY = 24;
  static final int DAYS_PER_WEEK = 7;

  private RepartitionAxisBuilder() {
  }

  /**
   * Builds the axes of a repartition view.
   *
   * @param weekdayLabels seven display labels, Monday first
   */
  public static RepartitionAxes build(RepartitionType type, LocalDateTime start, LocalDateTime end,
      List<String> weekdayLabels) {
    if (weekdayLabels == null || weekdayLabels.size() != DAYS_PER_WEEK) {
      throw new IllegalArgumentException("Exactly 7 weekday labels are required, Monday first");
    }
    return switch (type) {
      case WEEK -> new RepartitionAxes(
          new Axis(weekdayLabels, hourLabels(), null),
          AxisField.WEEK_DAY, AxisField.HOUR, Frequency.HOUR);
      case YEAR_HORIZONTAL -> {
        IsoWeeks weeks = isoWeeks(start, end);
        yield new RepartitionAxes(
            new Axis(weeks.numbers(), weekdayLabels, weeks.years()),
            AxisField.WEEK, AxisField.WEEK_DAY, Frequency.DAY);
      }
      case YEAR_VERTICAL -> {
        IsoWeeks weeks = isoWeeks(start, end);
        yield new RepartitionAxes(
            new Axis(weekdayLabels, weeks.numbers(), weeks.years()),
            AxisField.WEEK, AxisField.WEEK_DAY, Frequency.DAY);
      }
    };
  }

  // "00h" .. "24h", the last label only closes the final bucket
  static List<String> hourLabels() {
    List<String> hours = new ArrayList<>(HOURS_PER_DAY + 1);
    for (int hour = 0; hour <= HOURS_PER_DAY; hour++) {
      hours.add(String.format("%02dh", hour));
    }
    return hours;
  }

  /**
   * Steps weekly from {@code start} until the Sunday after {@code end}, so the last week shown is
   * always complete. An end falling on a Sunday is pushed to the next Sunday.
   */
  static IsoWeeks isoWeeks(LocalDateTime start, LocalDateTime end) {
    int daysToSunday = DAYS_PER_WEEK - end.getDayOfWeek().getValue() % DAYS_PER_WEEK;
    LocalDateTime endWeek = end.plusDays(daysToSunday);
    List<Integer> numbers = new ArrayList<>();
    List<Integer> years = new ArrayList<>();
    LocalDateTime current = start;
    while (!current.isAfter(endWeek)) {
      numbers.add(current.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
      years.add(current.get(IsoFields.WEEK_BASED_YEAR));
      current = current.plusWeeks(1);
    }
    return new IsoWeeks(numbers, years);
  }

  record IsoWeeks(List<Integer> numbers, List<Integer> years) {}
}
