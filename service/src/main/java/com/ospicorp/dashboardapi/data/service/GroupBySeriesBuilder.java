package com.ospicorp.dashboardapi.data.service;

import com.ospicorp.dashboardapi.data.model.GroupedValue;
import com.ospicorp.dashboardapi.data.model.SeriesChart;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class GroupBySeriesBuilder {
  private static final Logger log = LoggerFactory.getLogger(GroupBySeriesBuilder.class);
  private static final Double MISSING = 0d;

  private GroupBySeriesBuilder() {
  }

  /**
   * Places each grouped value at the position of its group key. Keys outside the category range
   * are ignored; categories without a value are zero.
   */
  public static SeriesChart build(List<String> categories, List<GroupedValue> rows) {
    List<Double> values = new ArrayList<>(Collections.nCopies(categories.size(), MISSING));
    for (GroupedValue row : rows) {
      int key = row.groupKey();
      if (key < 0 || key >= categories.size()) {
        log.debug("Ignoring group key {} outside 0..{}", key, categories.size() - 1);
        continue;
      }
      values.set(key, row.value() != null ? row.value() : MISSING);
    }
    return new SeriesChart(categories, categories, values);
  }
}
