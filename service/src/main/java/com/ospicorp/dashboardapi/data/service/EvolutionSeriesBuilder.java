package com.ospicorp.dashboardapi.data.service;

import com.ospicorp.dashboardapi.data.model.CalendarLabels;
import com.ospicorp.dashboardapi.data.model.DataPoint;
import com.ospicorp.dashboardapi.data.model.SeriesChart;
import com.ospicorp.dashboardapi.data.model.enums.Frequency;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class EvolutionSeriesBuilder {
  private static final Logger log = LoggerFactory.getLogger(EvolutionSeriesBuilder.class);
  private static final Double MISSING = 0d;

  private EvolutionSeriesBuilder() {
  }

  /**
   * Aligns storage rows on the calendar axis. Rows are matched by their formatted bucket date;
   * buckets without a row are zero.
   */
  public static SeriesChart build(CalendarLabels axis, Frequency frequency, List<DataPoint> rows) {
    List<String> keys = axis.primary();
    Map<String, Integer> positions = new HashMap<>(keys.size() * 2);
    for (int i = 0; i < keys.size(); i++) {
      positions.putIfAbsent(keys.get(i), i);
    }

    List<Double> values = new ArrayList<>(Collections.nCopies(keys.size(), MISSING));
    for (DataPoint row : rows) {
      String key = frequency.formatAxis(row.date());
      Integer position = positions.get(key);
      if (position == null) {
        log.debug("Dropping {} row for {} outside the axis", frequency, key);
        continue;
      }
      values.set(position, row.value() != null ? row.value() : MISSING);
    }
    return new SeriesChart(axis.labels(), keys, values);
  }
}
