package com.ospicorp.dashboardapi.web;

import io.swagger.v3.oas.annotations.Hidden;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Service index for the dashboard front end and load balancer checks. */
@RestController
@Hidden
public class RootController {
  private final String serviceName;
  private final boolean authEnabled;

  public RootController(@Value("${spring.application.name:dashboard-api}") String serviceName,
      @Value("${security.auth.enabled:false}") boolean authEnabled) {
    this.serviceName = serviceName;
    this.authEnabled = authEnabled;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", serviceName);
    body.put("status", "ok");
    body.put("auth", authEnabled ? "jwt" : "none");
    body.put("data", "/v1/data/{placeId}");
    body.put("docs", "/v3/api-docs");
    return body;
  }

  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    return ResponseEntity.ok(Map.of("pong", true));
  }
}
