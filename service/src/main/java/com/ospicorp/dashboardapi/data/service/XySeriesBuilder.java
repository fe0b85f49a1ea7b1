package com.ospicorp.dashboardapi.data.service;

import com.ospicorp.dashboardapi.data.model.XyChart;
import com.ospicorp.dashboardapi.data.model.XyPoint;
import com.ospicorp.dashboardapi.data.model.enums.Frequency;
import java.util.ArrayList;
import java.util.List;

public final class XySeriesBuilder {
  private XySeriesBuilder() {
  }

  public static XyChart build(Frequency frequency, List<XyPoint> rows) {
    List<Double> xs = new ArrayList<>(rows.size());
    List<Double> ys = new ArrayList<>(rows.size());
    List<String> dates = new ArrayList<>(rows.size());
    for (XyPoint row : rows) {
      xs.add(row.xValue());
      ys.add(row.yValue());
      dates.add(frequency.formatXy(row.date()));
    }
    return new XyChart(xs, ys, dates);
  }
}
