package com.ospicorp.dashboardapi.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Writes one access-log line per request and tags every log line of the request with a request
 * id, taken from {@code X-Request-Id} when the caller sends one.
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String REQUEST_ID_MDC_KEY = "requestId";

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    String requestId = request.getHeader(REQUEST_ID_HEADER);
    if (!StringUtils.hasText(requestId)) {
      requestId = UUID.randomUUID().toString();
    }
    MDC.put(REQUEST_ID_MDC_KEY, requestId);
    response.setHeader(REQUEST_ID_HEADER, requestId);
    long startTime = System.currentTimeMillis();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} from {} failed: {}",
          request.getMethod(),
          RequestContext.uriWithQuery(request),
          RequestContext.clientIp(request),
          ex.getMessage(),
          ex);
      throw ex;
    } finally {
      long duration = System.currentTimeMillis() - startTime;
      log.info("HTTP {} {} from {} -> {} ({} ms)",
          request.getMethod(),
          RequestContext.uriWithQuery(request),
          RequestContext.clientIp(request),
          response.getStatus(),
          duration);
      MDC.remove(REQUEST_ID_MDC_KEY);
    }
  }
}
