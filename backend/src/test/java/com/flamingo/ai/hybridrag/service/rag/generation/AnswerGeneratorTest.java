package com.flamingo.ai.hybridrag.service.rag.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.hybridrag.agent.AnswerGenerationAgent;
import com.flamingo.ai.hybridrag.domain.enums.PipelineStage;
import com.flamingo.ai.hybridrag.exception.LlmServiceException;
import com.flamingo.ai.hybridrag.service.rag.context.BlockSource;
import com.flamingo.ai.hybridrag.service.rag.context.MergedContext;
import com.flamingo.ai.hybridrag.service.rag.guard.RefusalPatterns;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AnswerGeneratorTest {

  private static final String QUESTION = "Where does John Smith work?";

  @Mock private AnswerGenerationAgent agent;

  private MeterRegistry meterRegistry;
  private AnswerGenerator generator;

  private final MergedContext context =
      new MergedContext(
          List.of("[Chunk c1 | notes.txt]\nJohn Smith works at Tech Corp."),
          List.of(BlockSource.chunk("c1")));

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    Retry retry =
        Retry.of(
            "test",
            RetryConfig.custom().maxAttempts(2).waitDuration(Duration.ofMillis(1)).build());
    generator = new AnswerGenerator(agent, retry, meterRegistry);
  }

  @Test
  void shouldReturnCanonicalRefusal_withoutCallingModel_whenContextIsEmpty() {
    String answer = generator.generate(QUESTION, MergedContext.EMPTY);

    assertThat(answer).isEqualTo(RefusalPatterns.INSUFFICIENT_INFORMATION);
    verify(agent, never()).answer(anyString(), anyString());
    assertThat(meterRegistry.counter("rag.generation.skipped").count()).isEqualTo(1.0);
  }

  @Test
  void shouldPassRenderedContextAndStripAnswer() {
    when(agent.answer(context.render(), QUESTION)).thenReturn("  John Smith works at Tech Corp. ");

    assertThat(generator.generate(QUESTION, context))
        .isEqualTo("John Smith works at Tech Corp.");
  }

  @Test
  void shouldReturnEmptyText_whenModelReturnsNull() {
    when(agent.answer(anyString(), anyString())).thenReturn(null);

    assertThat(generator.generate(QUESTION, context)).isEmpty();
  }

  @Test
  void shouldRetryOnceThenFailWithGeneratingStage() {
    when(agent.answer(anyString(), anyString())).thenThrow(new RuntimeException("503 from model"));

    assertThatThrownBy(() -> generator.generate(QUESTION, context))
        .isInstanceOf(LlmServiceException.class)
        .extracting("stage")
        .isEqualTo(PipelineStage.GENERATING);
    verify(agent, times(2)).answer(anyString(), anyString());
  }
}
