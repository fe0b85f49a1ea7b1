package com.ospicorp.dashboardapi.data.model.enums;

/** SQL aggregate functions exposed as scalar endpoints. */
public enum Aggregation {
  SUM,
  AVG,
  MAX,
  MIN
}
