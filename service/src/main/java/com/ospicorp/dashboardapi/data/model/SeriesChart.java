package com.ospicorp.dashboardapi.data.model;

import java.util.ArrayList;
import java.util.List;

/** One-dimensional chart: display labels, axis keys and one value per key. */
public record SeriesChart(List<String> label, List<String> axeX, List<Double> axeY) {

  public SeriesChart {
    label = List.copyOf(label);
    axeX = List.copyOf(axeX);
    axeY = List.copyOf(axeY);
    if (axeX.size() != axeY.size() || label.size() != axeX.size()) {
      throw new IllegalArgumentException("label, axeX and axeY must have the same length");
    }
  }

  public List<SeriesRow> toRows() {
    List<SeriesRow> rows = new ArrayList<>(axeX.size());
    for (int i = 0; i < axeX.size(); i++) {
      rows.add(new SeriesRow(label.get(i), axeX.get(i), axeY.get(i)));
    }
    return rows;
  }
}
