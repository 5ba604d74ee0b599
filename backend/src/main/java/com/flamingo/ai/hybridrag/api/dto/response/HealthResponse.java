package com.flamingo.ai.hybridrag.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for backing-store readiness and corpus statistics. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {

  public static final String UP = "UP";
  public static final String DEGRADED = "DEGRADED";

  private String status;
  private boolean vectorStore;
  private boolean graphStore;
  private boolean llmConfigured;

  /** -1 when the vector store is unreachable. */
  private long totalChunks;

  private long totalEntities;
  private long totalRelations;
  private LocalDateTime timestamp;
}
