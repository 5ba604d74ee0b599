package com.flamingo.ai.hybridrag.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.hybridrag.api.dto.request.QueryRequest;
import com.flamingo.ai.hybridrag.domain.enums.PipelineStage;
import com.flamingo.ai.hybridrag.domain.enums.QueryType;
import com.flamingo.ai.hybridrag.domain.enums.Verdict;
import com.flamingo.ai.hybridrag.elasticsearch.DocumentChunk;
import com.flamingo.ai.hybridrag.exception.GlobalExceptionHandler;
import com.flamingo.ai.hybridrag.exception.InvalidQuestionException;
import com.flamingo.ai.hybridrag.exception.LlmServiceException;
import com.flamingo.ai.hybridrag.exception.PipelineTimeoutException;
import com.flamingo.ai.hybridrag.service.rag.graph.GraphRetrievalResult;
import com.flamingo.ai.hybridrag.service.rag.guard.ComponentScores;
import com.flamingo.ai.hybridrag.service.rag.guard.ConfidenceReport;
import com.flamingo.ai.hybridrag.service.rag.pipeline.Answer;
import com.flamingo.ai.hybridrag.service.rag.pipeline.HybridRagPipeline;
import com.flamingo.ai.hybridrag.service.rag.pipeline.QueryCommand;
import com.flamingo.ai.hybridrag.service.rag.retrieval.ScoredChunk;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("QueryController Tests")
class QueryControllerTest {

  private static final String QUESTION = "Where is Tech Corp located?";

  @Mock private HybridRagPipeline pipeline;

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new QueryController(pipeline))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    objectMapper = new ObjectMapper();
  }

  @Test
  @DisplayName("Should return the answer with sources and confidence details")
  void shouldReturnAnswer() throws Exception {
    when(pipeline.answer(new QueryCommand(QUESTION, true, null))).thenReturn(answer());

    mockMvc
        .perform(
            post("/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(QueryRequest.builder().question(QUESTION).build())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.answer").value("Tech Corp is located in Berlin."))
        .andExpect(jsonPath("$.queryType").value("factual"))
        .andExpect(jsonPath("$.rejected").value(false))
        .andExpect(jsonPath("$.sources[0].chunkId").value("doc-1_0"))
        .andExpect(jsonPath("$.confidenceDetails.verdict").value("ACCEPT"))
        .andExpect(jsonPath("$.reasoningSteps.length()").value(2));
  }

  @Test
  void shouldPassHybridFlagAndTopK_toPipeline() throws Exception {
    when(pipeline.answer(any())).thenReturn(answer());

    mockMvc
        .perform(
            post("/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    body(
                        QueryRequest.builder()
                            .question(QUESTION)
                            .useHybrid(false)
                            .topK(3)
                            .build())))
        .andExpect(status().isOk());

    verify(pipeline).answer(new QueryCommand(QUESTION, false, 3));
  }

  @Test
  void shouldReturn400_whenQuestionIsBlank() throws Exception {
    mockMvc
        .perform(
            post("/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"   \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verifyNoInteractions(pipeline);
  }

  @Test
  void shouldReturn400_whenTopKIsBelowOne() throws Exception {
    mockMvc
        .perform(
            post("/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"What is it?\",\"topK\":0}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }

  @Test
  void shouldReturn400_whenPipelineRejectsTopK() throws Exception {
    when(pipeline.answer(any()))
        .thenThrow(new InvalidQuestionException("topK must be between 1 and 20, got 50"));

    mockMvc
        .perform(
            post("/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"What is it?\",\"topK\":50}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("topK must be between 1 and 20, got 50"));
  }

  @Test
  void shouldReturn503_whenLanguageModelIsUnavailable() throws Exception {
    when(pipeline.answer(any()))
        .thenThrow(
            new LlmServiceException(
                PipelineStage.GENERATING, "Answer generation failed", new RuntimeException()));

    mockMvc
        .perform(
            post("/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(QueryRequest.builder().question(QUESTION).build())))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("LLM_001"))
        .andExpect(jsonPath("$.stage").value("GENERATING"));
  }

  @Test
  void shouldReturn504_whenPipelineTimesOut() throws Exception {
    when(pipeline.answer(any()))
        .thenThrow(
            new PipelineTimeoutException(PipelineStage.RETRIEVING, Duration.ofSeconds(30)));

    mockMvc
        .perform(
            post("/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body(QueryRequest.builder().question(QUESTION).build())))
        .andExpect(status().isGatewayTimeout())
        .andExpect(jsonPath("$.code").value("PIPELINE_001"))
        .andExpect(jsonPath("$.stage").value("RETRIEVING"));
  }

  private String body(QueryRequest request) throws Exception {
    return objectMapper.writeValueAsString(request);
  }

  private static Answer answer() {
    DocumentChunk chunk =
        DocumentChunk.builder()
            .id("doc-1_0")
            .documentId("doc-1")
            .fileName("companies.txt")
            .content("Tech Corp is located in Berlin.")
            .build();
    ConfidenceReport report =
        new ConfidenceReport(
            0.82,
            new ComponentScores(0.9, 1.0, 1.0, 1.0, 0.33, 0.31),
            Verdict.ACCEPT,
            "Confidence 0.820 meets threshold 0.400");
    return new Answer(
        "Tech Corp is located in Berlin.",
        report,
        QueryType.FACTUAL,
        List.of(new ScoredChunk(chunk, 0.9)),
        GraphRetrievalResult.EMPTY,
        List.of("Classifying: Query classified as factual", "Done: Returned answer"));
  }
}
