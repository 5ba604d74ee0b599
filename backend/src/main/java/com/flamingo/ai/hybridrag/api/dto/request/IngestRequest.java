package com.flamingo.ai.hybridrag.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting a plain-text document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {

  @NotBlank(message = "File name is required")
  @Size(max = 255, message = "File name must not exceed 255 characters")
  private String fileName;

  @NotBlank(message = "Content is required")
  private String content;

  /** Existing document to replace. If null, a new id is generated. */
  private String documentId;
}
