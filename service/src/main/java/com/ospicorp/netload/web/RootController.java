package com.ospicorp.netload.web;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {

  private final String serviceName;
  private final String storeBucket;
  private final int boundaryShiftPeriods;

  public RootController(
      @Value("${spring.application.name:netload-service}") String serviceName,
      @Value("${load.store.bucket:realised/autogen}") String storeBucket,
      @Value("${load.aggregation.boundary-shift-periods:2}") int boundaryShiftPeriods) {
    this.serviceName = serviceName;
    this.storeBucket = storeBucket;
    this.boundaryShiftPeriods = boundaryShiftPeriods;
  }

  @GetMapping("/")
  public Map<String, Object> root() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("service", serviceName);
    body.put("status", "ok");
    body.put("endpoints", List.of("/v1/jobs/{id}/load", "/v1/jobs/{id}/systems/load",
        "/v1/systems/load"));
    return body;
  }

  // reports the store settings the net load depends on
  @GetMapping("/v1/ping")
  public ResponseEntity<Map<String, Object>> ping() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("pong", true);
    body.put("time", Instant.now().toString());
    body.put("bucket", storeBucket);
    body.put("boundary_shift_periods", boundaryShiftPeriods);
    return ResponseEntity.ok(body);
  }
}
