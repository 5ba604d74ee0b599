package com.flamingo.ai.hybridrag.api.dto.response;

import com.flamingo.ai.hybridrag.service.ingestion.IngestionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an ingested document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestResponse {

  private String documentId;
  private String fileName;
  private int chunkCount;
  private int entityCount;
  private int relationCount;
  private boolean graphWritten;

  public static IngestResponse fromResult(IngestionResult result) {
    return IngestResponse.builder()
        .documentId(result.documentId())
        .fileName(result.fileName())
        .chunkCount(result.chunkCount())
        .entityCount(result.entityCount())
        .relationCount(result.relationCount())
        .graphWritten(result.graphWritten())
        .build();
  }
}
