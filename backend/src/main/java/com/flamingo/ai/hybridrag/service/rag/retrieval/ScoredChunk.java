package com.flamingo.ai.hybridrag.service.rag.retrieval;

import com.flamingo.ai.hybridrag.elasticsearch.DocumentChunk;

/**
 * A chunk paired with its similarity to the query.
 *
 * @param chunk the matched chunk
 * @param score similarity in [0,1] once it has passed through {@link VectorRetriever}
 */
public record ScoredChunk(DocumentChunk chunk, double score) {

  public String chunkId() {
    return chunk.getId();
  }

  public String documentId() {
    return chunk.getDocumentId();
  }

  public String content() {
    return chunk.getContent();
  }

  ScoredChunk withScore(double newScore) {
    return new ScoredChunk(chunk, newScore);
  }
}
