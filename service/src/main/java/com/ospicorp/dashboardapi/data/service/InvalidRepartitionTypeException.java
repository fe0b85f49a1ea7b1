package com.ospicorp.dashboardapi.data.service;

public class InvalidRepartitionTypeException extends IllegalArgumentException {
  private final String repartitionType;

  public InvalidRepartitionTypeException(String repartitionType) {
    super("Unknown repartition type: " + repartitionType);
    this.repartitionType = repartitionType;
  }

  public String repartitionType() {
    return repartitionType;
  }
}
