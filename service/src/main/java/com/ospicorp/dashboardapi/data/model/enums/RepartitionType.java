package com.ospicorp.dashboardapi.data.model.enums;

import com.ospicorp.dashboardapi.data.service.InvalidRepartitionTypeException;
import java.util.Locale;

public enum RepartitionType {
  WEEK("week"),
  YEAR_HORIZONTAL("year_h"),
  YEAR_VERTICAL("year_v");

  private final String code;

  RepartitionType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public boolean weekStyle() {
    return this == WEEK;
  }

  /**
   * Accepts the short wire code ({@code week}, {@code year_h}, {@code year_v}) or the constant
   * name, ignoring case.
   */
  public static RepartitionType fromCode(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (RepartitionType type : values()) {
        if (type.code.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
          return type;
        }
      }
    }
    throw new InvalidRepartitionTypeException(value);
  }
}
