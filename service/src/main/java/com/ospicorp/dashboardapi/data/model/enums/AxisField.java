package com.ospicorp.dashboardapi.data.model.enums;

/**
 * Bucket coordinate used as a repartition axis. The field name is the one exposed to clients,
 * the column is the matching {@code data_value} column.
 */
public enum AxisField {
  WEEK_DAY("weekDay", "week_day"),
  HOUR("hour", "hour"),
  WEEK("week", "week");

  private final String fieldName;
  private final String column;

  AxisField(String fieldName, String column) {
    this.fieldName = fieldName;
    this.column = column;
  }

  public String fieldName() {
    return fieldName;
  }

  public String column() {
    return column;
  }
}
