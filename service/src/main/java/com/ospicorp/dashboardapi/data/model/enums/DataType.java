package com.ospicorp.dashboardapi.data.model.enums;

import java.util.Locale;

/** Kind of measurement carried by a feed. */
public enum DataType {
  CONSO_ELEC,
  TEMPERATURE,
  DJU,
  PRESSURE,
  NEBULOSITY,
  HUMIDITY;

  public static DataType fromCode(String code) {
    if (code == null) {
      throw new IllegalArgumentException("Data type must be provided");
    }
    return DataType.valueOf(code.trim().toUpperCase(Locale.ROOT));
  }
}
