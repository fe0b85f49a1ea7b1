package com.ospicorp.dashboardapi.data.model;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Dense heatmap cells. A {@code null} value is a blank cell (no data), which is written as an
 * empty string on the wire so that charts can tell it apart from a measured zero.
 */
public record RepartitionGrid(
    @JsonSerialize(using = BlankCellSerializer.class) List<Double> values,
    List<String> dates
) {

  public static final Double BLANK = null;

  public RepartitionGrid {
    if (values.size() != dates.size()) {
      throw new IllegalArgumentException(
          "values and dates must have the same length: " + values.size() + " != " + dates.size());
    }
    values = Collections.unmodifiableList(new ArrayList<>(values));
    dates = List.copyOf(dates);
  }

  public int size() {
    return values.size();
  }

  public boolean isBlank(int index) {
    return values.get(index) == BLANK;
  }
}
