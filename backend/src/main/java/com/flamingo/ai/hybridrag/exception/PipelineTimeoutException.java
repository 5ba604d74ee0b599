package com.flamingo.ai.hybridrag.exception;

import com.flamingo.ai.hybridrag.domain.enums.PipelineStage;
import java.time.Duration;

/** Exception thrown when a question is not answered before the pipeline deadline. */
public class PipelineTimeoutException extends RuntimeException {

  private final PipelineStage stage;
  private final Duration timeout;

  public PipelineTimeoutException(PipelineStage stage, Duration timeout) {
    super("Pipeline timed out after " + timeout.toMillis() + " ms during " + stage);
    this.stage = stage;
    this.timeout = timeout;
  }

  public PipelineStage getStage() {
    return stage;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
