package com.example.ordergateway.web.rest.controller;

import com.example.ordergateway.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health Check Controller
 *
 * Public and dependency-free: it does not contact the order service.
 */
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthAPI {

  private static final String STATUS_OK = "ok";

  private final ApplicationProperties properties;

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> status = new LinkedHashMap<>();
    status.put("status", STATUS_OK);
    status.put("order_service_url", properties.upstream().baseUrl());
    return ResponseEntity.ok(status);
  }
}
