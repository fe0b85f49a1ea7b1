package com.ospicorp.dashboardapi.data.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Paired measurements of two feeds, in storage order. Values may be null. */
public record XyChart(List<Double> axeX, List<Double> axeY, List<String> date) {

  public XyChart {
    if (axeX.size() != axeY.size() || axeX.size() != date.size()) {
      throw new IllegalArgumentException("axeX, axeY and date must have the same length");
    }
    axeX = Collections.unmodifiableList(new ArrayList<>(axeX));
    axeY = Collections.unmodifiableList(new ArrayList<>(axeY));
    date = List.copyOf(date);
  }
}
