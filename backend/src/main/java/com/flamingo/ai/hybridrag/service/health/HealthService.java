package com.flamingo.ai.hybridrag.service.health;

import com.flamingo.ai.hybridrag.api.dto.response.HealthResponse;

/** Service interface for health checks and corpus statistics. */
public interface HealthService {

  /**
   * Probes the vector index and the graph store.
   *
   * @return readiness of each store and its counts; never throws for an unreachable store
   */
  HealthResponse getSystemStatus();
}
