package com.flamingo.ai.hybridrag.service.rag.classification;

import com.flamingo.ai.hybridrag.agent.QueryClassificationAgent;
import com.flamingo.ai.hybridrag.config.ResilienceConfig;
import com.flamingo.ai.hybridrag.domain.enums.QueryType;
import com.flamingo.ai.hybridrag.domain.model.QueryClassification;
import com.flamingo.ai.hybridrag.exception.InvalidQuestionException;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Labels a question as factual, relational or reasoning.
 *
 * <p>Never fails once the question is valid: an unreadable label or an unavailable model both
 * resolve to {@link QueryType#DEFAULT} with the reason recorded in the rationale. An interrupted
 * call is a cancellation, not an outage, and surfaces as {@link CancellationException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryClassifier {

  private final QueryClassificationAgent agent;

  private final Retry llmRetry;
  private final MeterRegistry meterRegistry;

  @Timed(value = "rag.classification", description = "Time to classify a question")
  public QueryClassification classify(String question) {
    if (question == null || question.isBlank()) {
      throw new InvalidQuestionException("Question must not be empty");
    }

    String rawLabel;
    try {
      rawLabel = Retry.decorateSupplier(llmRetry, () -> agent.classify(question.strip())).get();
    } catch (RuntimeException e) {
      if (ResilienceConfig.isInterruption(e)) {
        Thread.currentThread().interrupt();
        throw new CancellationException("Query classification interrupted");
      }
      log.warn("Query classification unavailable, using {}: {}", QueryType.DEFAULT, e.getMessage());
      meterRegistry.counter("rag.classification.fallback", "reason", "unavailable").increment();
      return QueryClassification.fallback(
          "Classifier unavailable ("
              + e.getClass().getSimpleName()
              + "), defaulted to "
              + QueryType.DEFAULT.getLabel());
    }

    String normalized = normalizeLabel(rawLabel);
    Optional<QueryType> type = QueryType.fromLabel(normalized);
    if (type.isEmpty()) {
      log.debug("Unrecognized classification label '{}', using {}", rawLabel, QueryType.DEFAULT);
      meterRegistry.counter("rag.classification.fallback", "reason", "unrecognized").increment();
      return QueryClassification.fallback(
          "Unrecognized label '" + normalized + "', defaulted to " + QueryType.DEFAULT.getLabel());
    }

    meterRegistry.counter("rag.classification", "type", type.get().getLabel()).increment();
    return QueryClassification.of(type.get(), "Model labelled the question as " + normalized);
  }

  /** Case-folds the label and strips whitespace, quotes and trailing punctuation. */
  static String normalizeLabel(String raw) {
    if (raw == null) {
      return "";
    }
    String label = raw.strip().toLowerCase(Locale.ROOT);
    int start = 0;
    int end = label.length();
    while (start < end && isDecoration(label.charAt(start))) {
      start++;
    }
    while (end > start && isDecoration(label.charAt(end - 1))) {
      end--;
    }
    return label.substring(start, end).strip();
  }

  private static boolean isDecoration(char c) {
    return Character.isWhitespace(c) || "\"'`.,;:!*".indexOf(c) >= 0;
  }
}
