package com.ospicorp.dashboardapi.data.service;

import com.ospicorp.dashboardapi.data.model.Axis;
import com.ospicorp.dashboardapi.data.model.RepartitionAggregate;
import com.ospicorp.dashboardapi.data.model.RepartitionGrid;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lays aggregate tuples onto a dense heatmap grid whose size and order come from the axis alone.
 * Cells without a tuple stay blank.
 */
public final class AggregateGridBuilder {
  private static final Logger log = LoggerFactory.getLogger(AggregateGridBuilder.class);
  static final DateTimeFormatter CELL_DATE = DateTimeFormatter.ofPattern("dd/MM/yy");

  private AggregateGridBuilder() {
  }

  /**
   * Merges {@code aggregates} onto a grid.
   *
   * <p>Week-style axes have weekday labels on X and hour labels on Y. Year-style axes must have
   * ISO week numbers on X with their years in {@link Axis#year()}; callers transpose vertical
   * axes before merging.
   */
  public static RepartitionGrid merge(Axis axis, boolean weekStyle,
      List<RepartitionAggregate> aggregates) {
    return weekStyle
        ? mergeWeek(axis, aggregates)
        : mergeYear(axis, aggregates);
  }

  private static RepartitionGrid mergeWeek(Axis axis, List<RepartitionAggregate> aggregates) {
    List<?> days = axis.x();
    List<?> hours = axis.y();
    int rowLength = GridIndexer.rowLength(hours.size(), true);
    int size = days.size() * rowLength;
    List<Double> values = new ArrayList<>(Collections.nCopies(size, RepartitionGrid.BLANK));
    List<String> dates = new ArrayList<>(Collections.nCopies(size, null));

    for (int x = 0; x < days.size(); x++) {
      for (int y = 0; y < rowLength; y++) {
        // e.g. "Mon. 12h -> 13h"
        dates.set(GridIndexer.index(x, y, rowLength),
            days.get(x) + " " + hours.get(y) + " -> " + hours.get(y + 1));
      }
    }

    for (RepartitionAggregate aggregate : aggregates) {
      if (aggregate.xKey() < 0 || aggregate.xKey() >= days.size()
          || aggregate.yKey() < 0 || aggregate.yKey() >= rowLength) {
        log.debug("Dropping aggregate outside the week grid: {}", aggregate);
        continue;
      }
      values.set(GridIndexer.index(aggregate.xKey(), aggregate.yKey(), rowLength),
          aggregate.value());
    }
    return new RepartitionGrid(values, dates);
  }

  private static RepartitionGrid mergeYear(Axis axis, List<RepartitionAggregate> aggregates) {
    List<?> weeks = axis.x();
    List<?> days = axis.y();
    List<Integer> years = axis.year();
    if (years == null || years.size() != weeks.size()) {
      throw new IllegalArgumentException("Year-style axes need one ISO year per week");
    }
    int rowLength = GridIndexer.rowLength(days.size(), false);
    int size = weeks.size() * rowLength;
    List<Double> values = new ArrayList<>(Collections.nCopies(size, RepartitionGrid.BLANK));
    List<String> dates = new ArrayList<>(size);
    Map<String, Integer> cellByDate = new HashMap<>(size * 2);

    for (int x = 0; x < weeks.size(); x++) {
      int week = ((Number) weeks.get(x)).intValue();
      for (int y = 0; y < rowLength; y++) {
        String date = CELL_DATE.format(GridIndexer.reconstructDate(years.get(x), week, y + 1));
        int index = GridIndexer.index(x, y, rowLength);
        dates.add(date);
        cellByDate.putIfAbsent(date, index);
      }
    }

    // Tuples are matched on their calendar date rather than on their raw coordinates, so rows
    // whose ISO year/week straddle a year boundary still land on the right cell.
    for (RepartitionAggregate aggregate : aggregates) {
      if (aggregate.year() == null) {
        log.debug("Dropping aggregate without ISO year: {}", aggregate);
        continue;
      }
      String date = CELL_DATE.format(GridIndexer.reconstructDate(
          aggregate.year(), aggregate.xKey(), aggregate.yKey() + 1));
      Integer index = cellByDate.get(date);
      if (index == null) {
        log.debug("Dropping aggregate for {} outside the axis: {}", date, aggregate);
        continue;
      }
      values.set(index, aggregate.value());
    }
    return new RepartitionGrid(values, dates);
  }
}
