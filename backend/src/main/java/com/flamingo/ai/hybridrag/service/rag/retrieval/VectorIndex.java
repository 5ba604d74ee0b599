package com.flamingo.ai.hybridrag.service.rag.retrieval;

import com.flamingo.ai.hybridrag.elasticsearch.DocumentChunk;
import java.util.List;

/** Similarity search and writes over embedded chunks. */
public interface VectorIndex {

  /**
   * Returns up to {@code k} chunks ranked by similarity to {@code vector}. An empty index yields an
   * empty list.
   */
  List<ScoredChunk> search(List<Float> vector, int k);

  /** Inserts or replaces a single chunk with the given embedding. */
  default void upsert(DocumentChunk chunk, List<Float> vector) {
    upsertAll(List.of(chunk.withEmbedding(vector)));
  }

  /** Inserts or replaces chunks that already carry their embeddings. */
  void upsertAll(List<DocumentChunk> chunks);

  /** Removes every chunk of a document. */
  void deleteByDocument(String documentId);

  /** Number of indexed chunks. */
  long count();
}
