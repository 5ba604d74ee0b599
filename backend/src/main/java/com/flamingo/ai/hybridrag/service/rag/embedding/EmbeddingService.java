package com.flamingo.ai.hybridrag.service.rag.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Generates text embeddings for questions and chunks. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; characters are a conservative proxy
  private static final int MAX_CHARS_PER_EMBEDDING = 8000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a question.
   *
   * @return the vector, or an empty list when the embedding capability is unavailable
   */
  @CircuitBreaker(name = "openai", fallbackMethod = "embedQueryFallback")
  @Retry(name = "openai")
  public List<Float> embedQuery(String text) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(truncate(text));
      meterRegistry.counter("embedding.requests.success").increment();
      return toList(response.content());
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  /**
   * Embeds chunk texts in one batch. The result is index-aligned with {@code texts}; an empty
   * result means the capability was unavailable.
   */
  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextsFallback")
  @Retry(name = "openai")
  public List<List<Float>> embedTexts(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<TextSegment> segments = texts.stream().map(t -> TextSegment.from(truncate(t))).toList();
      Response<List<Embedding>> response = embeddingModel.embedAll(segments);
      List<List<Float>> results = new ArrayList<>(segments.size());
      for (Embedding embedding : response.content()) {
        results.add(toList(embedding));
      }
      meterRegistry.counter("embedding.requests.success").increment();
      log.debug("Embedded {} texts", results.size());
      return results;
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  private String truncate(String text) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} chars to {} chars",
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private static List<Float> toList(Embedding embedding) {
    float[] vector = embedding.vector();
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String text, Throwable t) {
    log.error("Query embedding failed, circuit breaker fallback: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedTextsFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} texts failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return List.of();
  }
}
