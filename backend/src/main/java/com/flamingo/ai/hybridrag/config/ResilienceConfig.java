package com.flamingo.ai.hybridrag.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Retry policy for the language model calls made by the classifier and the answer generator.
 *
 * <p>The embedding and index calls are guarded declaratively through the {@code openai} and
 * {@code elasticsearch} instances in application.yml instead.
 */
@Configuration
@Slf4j
public class ResilienceConfig {

  @Bean
  public Retry llmRetry(RagConfig ragConfig) {
    RagConfig.Llm llm = ragConfig.getLlm();
    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(llm.getMaxAttempts())
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(
                    llm.getInitialBackoff(), llm.getBackoffMultiplier()))
            .retryOnException(ResilienceConfig::isRetryable)
            .build();
    Retry retry = Retry.of("llm", config);
    retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Retrying language model call (attempt {}): {}",
                    event.getNumberOfRetryAttempts(),
                    event.getLastThrowable() != null
                        ? event.getLastThrowable().getMessage()
                        : "unknown"));
    return retry;
  }

  /** Runtime failures are retried unless they stem from an interrupted (cancelled) call. */
  public static boolean isRetryable(Throwable error) {
    return error instanceof RuntimeException
        && !isInterruption(error)
        && !Thread.currentThread().isInterrupted();
  }

  /** True when {@code error} or any of its causes is an {@link InterruptedException}. */
  public static boolean isInterruption(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof InterruptedException) {
        return true;
      }
    }
    return false;
  }
}
