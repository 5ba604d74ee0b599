package com.flamingo.ai.hybridrag.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking a question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

  @NotBlank(message = "Question is required")
  @Size(max = 2000, message = "Question must not exceed 2000 characters")
  private String question;

  /** When false, graph traversal is skipped regardless of the query type. */
  @Builder.Default private boolean useHybrid = true;

  /** Optional vector hit override, capped by configuration. If null, uses the default. */
  @Min(value = 1, message = "topK must be at least 1")
  private Integer topK;
}
