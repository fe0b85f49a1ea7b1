package com.ospicorp.dashboardapi.data.service;

import com.ospicorp.dashboardapi.data.model.CalendarLabels;
import com.ospicorp.dashboardapi.data.model.enums.Frequency;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public final class FrequencyCalendar {
  private FrequencyCalendar() {
  }

  /**
   * Lists every bucket of {@code frequency} from {@code start} up to and including {@code end}.
   *
   * @return axis keys and long labels, one entry per bucket
   */
  public static CalendarLabels labels(Frequency frequency, LocalDateTime start, LocalDateTime end) {
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("start must be before or equal to end");
    }
    List<String> primary = new ArrayList<>();
    List<String> labels = new ArrayList<>();
    LocalDateTime current = start;
    for (long i = 1; !current.isAfter(end); i++) {
      primary.add(frequency.formatAxis(current));
      labels.add(frequency.formatLabel(current));
      current = frequency.step(start, i);
    }
    return new CalendarLabels(primary, labels);
  }
}
