package com.flamingo.ai.hybridrag.service.rag.pipeline;

import java.time.Duration;

/**
 * Immutable configuration of the pipeline orchestrator.
 *
 * @param defaultTopK vector hits per question when the request does not say
 * @param maxTopK largest accepted per-request top-k
 * @param graphMaxDepth hop limit for graph traversal
 * @param timeout deadline for one question, end to end
 */
public record PipelineSettings(
    int defaultTopK, int maxTopK, int graphMaxDepth, Duration timeout) {

  public PipelineSettings {
    if (defaultTopK <= 0 || maxTopK < defaultTopK) {
      throw new IllegalArgumentException(
          "Invalid top-k settings: default=" + defaultTopK + ", max=" + maxTopK);
    }
    if (graphMaxDepth < 0) {
      throw new IllegalArgumentException("graphMaxDepth must not be negative");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }
}
