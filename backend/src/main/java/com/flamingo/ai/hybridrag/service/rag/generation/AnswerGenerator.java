package com.flamingo.ai.hybridrag.service.rag.generation;

import com.flamingo.ai.hybridrag.agent.AnswerGenerationAgent;
import com.flamingo.ai.hybridrag.config.ResilienceConfig;
import com.flamingo.ai.hybridrag.domain.enums.PipelineStage;
import com.flamingo.ai.hybridrag.exception.LlmServiceException;
import com.flamingo.ai.hybridrag.service.rag.context.MergedContext;
import com.flamingo.ai.hybridrag.service.rag.guard.RefusalPatterns;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.CancellationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Produces an answer grounded in the merged context. Accept or reject is left to the guard.
 *
 * <p>An empty context short-circuits to the canonical refusal without calling the model.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerGenerator {

  private final AnswerGenerationAgent agent;
  private final Retry llmRetry;
  private final MeterRegistry meterRegistry;

  /**
   * Generates the answer text.
   *
   * @throws LlmServiceException when the model is still unavailable after the retry
   */
  @Timed(value = "rag.generation", description = "Time to generate an answer")
  public String generate(String question, MergedContext context) {
    if (context.isEmpty()) {
      meterRegistry.counter("rag.generation.skipped").increment();
      return RefusalPatterns.INSUFFICIENT_INFORMATION;
    }

    String rendered = context.render();
    try {
      String answer =
          Retry.decorateSupplier(llmRetry, () -> agent.answer(rendered, question)).get();
      meterRegistry.counter("rag.generation.success").increment();
      return answer == null ? "" : answer.strip();
    } catch (RuntimeException e) {
      if (ResilienceConfig.isInterruption(e)) {
        Thread.currentThread().interrupt();
        throw new CancellationException("Answer generation interrupted");
      }
      meterRegistry.counter("rag.generation.failure").increment();
      throw new LlmServiceException(
          PipelineStage.GENERATING, "Answer generation failed: " + e.getMessage(), e);
    }
  }
}
