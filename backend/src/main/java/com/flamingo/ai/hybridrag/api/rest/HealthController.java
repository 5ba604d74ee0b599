package com.flamingo.ai.hybridrag.api.rest;

import com.flamingo.ai.hybridrag.api.dto.response.HealthResponse;
import com.flamingo.ai.hybridrag.service.health.HealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and corpus statistics. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final HealthService healthService;

  /** Reports store readiness. Always 200; a degraded status is carried in the body. */
  @GetMapping
  public ResponseEntity<HealthResponse> health() {
    return ResponseEntity.ok(healthService.getSystemStatus());
  }
}
