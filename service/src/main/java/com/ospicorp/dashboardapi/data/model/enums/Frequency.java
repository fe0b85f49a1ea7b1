package com.ospicorp.dashboardapi.data.model.enums;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Bucketing frequency of stored values. Each constant knows how to step the calendar and how its
 * buckets are rendered on chart axes.
 */
public enum Frequency {
  HOUR(ChronoUnit.HOURS, "dd/MM/yyyy HH:mm", "EEEE dd/MM/yyyy HH:mm", "EEEE dd/MM/yyyy HH:mm"),
  DAY(ChronoUnit.DAYS, "dd/MM/yyyy", "EEEE dd/MM/yyyy", "EEEE dd/MM/yyyy"),
  WEEK(ChronoUnit.WEEKS, "dd/MM/yyyy", "dd/MM/yyyy", "dd/MM/yyyy"),
  MONTH(ChronoUnit.MONTHS, "MMM yyyy", "MMM yyyy", "MMM yyyy"),
  YEAR(ChronoUnit.YEARS, "yyyy", "yyyy", "yyyy");

  private final ChronoUnit unit;
  private final DateTimeFormatter axisFormat;
  private final DateTimeFormatter labelFormat;
  private final DateTimeFormatter xyFormat;

  Frequency(ChronoUnit unit, String axisPattern, String labelPattern, String xyPattern) {
    this.unit = unit;
    this.axisFormat = DateTimeFormatter.ofPattern(axisPattern, Locale.ENGLISH);
    this.labelFormat = DateTimeFormatter.ofPattern(labelPattern, Locale.ENGLISH);
    this.xyFormat = DateTimeFormatter.ofPattern(xyPattern, Locale.ENGLISH);
  }

  public static Frequency fromCode(String code) {
    if (code == null) {
      throw new IllegalArgumentException("Frequency code must be provided");
    }
    return Frequency.valueOf(code.trim().toUpperCase(Locale.ROOT));
  }

  /**
   * The {@code steps}-th bucket after {@code start}. Calendar units are added in one go from the
   * start, so month stepping keeps the start day-of-month and only clips at month end.
   */
  public LocalDateTime step(LocalDateTime start, long steps) {
    return start.plus(steps, unit);
  }

  public LocalDateTime bucketStart(LocalDateTime timestamp) {
    return switch (this) {
      case HOUR -> timestamp.truncatedTo(ChronoUnit.HOURS);
      case DAY -> timestamp.truncatedTo(ChronoUnit.DAYS);
      case WEEK -> timestamp.truncatedTo(ChronoUnit.DAYS)
          .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
      case MONTH -> timestamp.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
      case YEAR -> timestamp.truncatedTo(ChronoUnit.DAYS).withDayOfYear(1);
    };
  }

  public String formatAxis(LocalDateTime timestamp) {
    return axisFormat.format(timestamp);
  }

  public String formatLabel(LocalDateTime timestamp) {
    return labelFormat.format(timestamp);
  }

  public String formatXy(LocalDateTime timestamp) {
    return xyFormat.format(timestamp);
  }
}
