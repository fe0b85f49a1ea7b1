package com.ospicorp.dashboardapi.config;

import jakarta.servlet.http.HttpServletRequest;

/** Request details shared by the access log and the error log. */
final class RequestContext {
  private RequestContext() {
  }

  static String uriWithQuery(HttpServletRequest request) {
    String queryString = request.getQueryString();
    if (queryString == null || queryString.isBlank()) {
      return request.getRequestURI();
    }
    return request.getRequestURI() + "?" + queryString;
  }

  // first hop of X-Forwarded-For when behind the dashboard proxy
  static String clientIp(HttpServletRequest request) {
    String forwardedHeader = request.getHeader("X-Forwarded-For");
    if (forwardedHeader != null && !forwardedHeader.isBlank()) {
      return forwardedHeader.split(",")[0].trim();
    }
    return request.getRemoteAddr();
  }
}
