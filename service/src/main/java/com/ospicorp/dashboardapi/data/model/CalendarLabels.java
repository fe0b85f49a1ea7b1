package com.ospicorp.dashboardapi.data.model;

import java.util.List;

/**
 * Calendar buckets of a range. {@code primary} holds the short axis keys, {@code labels} the
 * longer display text of the same buckets.
 */
public record CalendarLabels(List<String> primary, List<String> labels) {

  public CalendarLabels {
    primary = List.copyOf(primary);
    labels = List.copyOf(labels);
    if (primary.size() != labels.size()) {
      throw new IllegalArgumentException("primary and long labels must have the same length");
    }
  }

  public int size() {
    return primary.size();
  }
}
