package com.flamingo.ai.hybridrag.exception;

import com.flamingo.ai.hybridrag.domain.enums.PipelineStage;

/** Exception thrown when the language model stays unavailable after retrying. */
public class LlmServiceException extends RuntimeException {

  private final PipelineStage stage;
  private final String userMessage;

  public LlmServiceException(PipelineStage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public PipelineStage getStage() {
    return stage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
