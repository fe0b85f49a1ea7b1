package com.ospicorp.dashboardapi.data.service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Index arithmetic shared by grid initialisation and merge, and ISO week-date reconstruction.
 */
public final class GridIndexer {
  private GridIndexer() {
  }

  public static int index(int xKey, int yKey, int rowLength) {
    return xKey * rowLength + yKey;
  }

  /**
   * Cells per X entry. The hour axis of week-style grids ends with a closing "24h" label that is
   * not a bucket of its own.
   */
  public static int rowLength(int yAxisLength, boolean weekStyle) {
    return weekStyle ? yAxisLength - 1 : yAxisLength;
  }

  /**
   * Calendar date of an ISO-8601 week date. Week 1 is the week holding the year's first
   * Thursday, weekday 1 is Monday. Values past the end of a week or year roll over into the next
   * one instead of failing, so week 53 of a 52-week year is week 1 of the following year.
   */
  public static LocalDate reconstructDate(int isoYear, int isoWeek, int isoWeekday) {
    LocalDate firstMonday = LocalDate.of(isoYear, 1, 4)
        .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    return firstMonday.plusWeeks(isoWeek - 1L).plusDays(isoWeekday - 1L);
  }
}
