package com.flamingo.ai.hybridrag.api.dto.response;

import com.flamingo.ai.hybridrag.service.rag.retrieval.ScoredChunk;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a chunk that grounded the answer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceResponse {

  private String chunkId;
  private String documentId;
  private String fileName;
  private double score;
  private String content;

  public static SourceResponse fromScoredChunk(ScoredChunk hit) {
    return SourceResponse.builder()
        .chunkId(hit.chunkId())
        .documentId(hit.documentId())
        .fileName(hit.chunk().getFileName())
        .score(hit.score())
        .content(hit.content())
        .build();
  }
}
