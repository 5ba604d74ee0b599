package com.flamingo.ai.hybridrag.api.dto.response;

import com.flamingo.ai.hybridrag.service.rag.guard.ConfidenceReport;
import com.flamingo.ai.hybridrag.service.rag.pipeline.Answer;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an answered question, accepted or rejected. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

  private String answer;
  private double confidence;
  private String queryType;
  private boolean rejected;
  private List<SourceResponse> sources;
  private KgContextResponse kgContext;
  private List<String> reasoningSteps;
  private ConfidenceDetails confidenceDetails;
  private LocalDateTime timestamp;

  /** Creates a QueryResponse from a pipeline answer. */
  public static QueryResponse fromAnswer(Answer answer) {
    ConfidenceReport report = answer.confidence();
    return QueryResponse.builder()
        .answer(answer.text())
        .confidence(report.score())
        .queryType(answer.queryType().getLabel())
        .rejected(!report.accepted())
        .sources(answer.sources().stream().map(SourceResponse::fromScoredChunk).toList())
        .kgContext(KgContextResponse.fromResult(answer.kgContext()))
        .reasoningSteps(answer.reasoningSteps())
        .confidenceDetails(
            new ConfidenceDetails(
                report.components().asMap(), report.verdict().name(), report.reason()))
        .timestamp(LocalDateTime.now())
        .build();
  }

  /** Guard breakdown. */
  public record ConfidenceDetails(Map<String, Double> components, String verdict, String reason) {}
}
