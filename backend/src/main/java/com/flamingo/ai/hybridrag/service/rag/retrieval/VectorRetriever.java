package com.flamingo.ai.hybridrag.service.rag.retrieval;

import com.flamingo.ai.hybridrag.service.rag.embedding.EmbeddingService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Semantic retrieval over the chunk index.
 *
 * <p>Results are ordered by descending score with ties broken by ascending chunk id, so a fixed
 * index and question always yield the same sequence. Scores are clamped to [0,1].
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VectorRetriever {

  static final Comparator<ScoredChunk> RANKING =
      Comparator.comparingDouble(ScoredChunk::score)
          .reversed()
          .thenComparing(ScoredChunk::chunkId, Comparator.nullsLast(Comparator.naturalOrder()));

  private final EmbeddingService embeddingService;
  private final VectorIndex vectorIndex;
  private final MeterRegistry meterRegistry;

  /**
   * Finds the chunks most similar to the question.
   *
   * @param question the question text
   * @param topK maximum number of hits, must be positive
   * @return ranked hits, empty when the index is empty or the question cannot be embedded
   */
  @Timed(value = "rag.retrieval.vector", description = "Time for vector retrieval")
  public List<ScoredChunk> search(String question, int topK) {
    if (topK <= 0) {
      throw new IllegalArgumentException("topK must be positive, got " + topK);
    }

    List<Float> queryVector = embeddingService.embedQuery(question);
    if (queryVector.isEmpty()) {
      log.warn("Question embedding unavailable, vector retrieval returns no hits");
      meterRegistry.counter("rag.retrieval.vector.empty_embedding").increment();
      return List.of();
    }

    List<ScoredChunk> hits =
        vectorIndex.search(queryVector, topK).stream()
            .map(hit -> hit.withScore(clamp(hit.score())))
            .sorted(RANKING)
            .limit(topK)
            .toList();

    meterRegistry.counter("rag.retrieval.vector.hits").increment(hits.size());
    if (log.isDebugEnabled()) {
      hits.forEach(
          hit ->
              log.debug(
                  "Vector hit {} score={}", hit.chunkId(), String.format("%.3f", hit.score())));
    }
    return hits;
  }

  static double clamp(double score) {
    if (Double.isNaN(score)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, score));
  }
}
