package com.flamingo.ai.hybridrag.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String PIPELINE_TIMEOUT = "PIPELINE_001";
  public static final String DOCUMENT_PROCESSING_ERROR = "DOCUMENT_003";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Pipeline stage that failed, for pipeline errors. */
  private final String stage;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
