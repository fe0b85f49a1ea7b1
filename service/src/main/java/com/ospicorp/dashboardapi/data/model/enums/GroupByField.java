package com.ospicorp.dashboardapi.data.model.enums;

import java.util.Locale;

/** Columns a sum can be grouped by. The field name is the path code clients send. */
public enum GroupByField {
  WEEK_DAY("weekDay", "week_day");

  private final String fieldName;
  private final String column;

  GroupByField(String fieldName, String column) {
    this.fieldName = fieldName;
    this.column = column;
  }

  public String fieldName() {
    return fieldName;
  }

  public String column() {
    return column;
  }

  public static GroupByField fromCode(String value) {
    if (value != null) {
      String normalized = value.trim();
      for (GroupByField field : values()) {
        if (field.fieldName.equalsIgnoreCase(normalized)
            || field.name().equals(normalized.toUpperCase(Locale.ROOT))) {
          return field;
        }
      }
    }
    throw new IllegalArgumentException("Unsupported group-by field: " + value);
  }
}
