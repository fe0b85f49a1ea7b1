package com.ospicorp.dashboardapi.data.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Chart axes. Labels are either display strings (weekdays, hours) or ISO week numbers;
 * {@code year} is aligned with the week-valued axis and is null when no axis carries weeks.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Axis(List<?> x, List<?> y, List<Integer> year) {

  public Axis {
    x = List.copyOf(x);
    y = List.copyOf(y);
    year = year == null ? null : List.copyOf(year);
  }

  public Axis transpose() {
    return new Axis(y, x, year);
  }
}
