package com.ospicorp.dashboardapi.data.controller;

/** Rejected request parameter, reported with a stable error code and a link to its docs. */
public class InvalidParameterException extends RuntimeException {
  private final int errorCode;
  private final String moreInfo;

  public InvalidParameterException(String message, int errorCode, String moreInfo, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
    this.moreInfo = moreInfo;
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return moreInfo;
  }
}
