package com.ospicorp.dashboardapi.data.model;

import com.ospicorp.dashboardapi.data.model.enums.AxisField;
import com.ospicorp.dashboardapi.data.model.enums.Frequency;

/** Axis of a repartition view plus the storage coordinates and frequency feeding it. */
public record RepartitionAxes(Axis axis, AxisField xField, AxisField yField, Frequency frequency) {}
