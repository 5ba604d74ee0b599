package com.flamingo.ai.hybridrag.service.rag.pipeline;

import com.flamingo.ai.hybridrag.domain.enums.QueryType;
import com.flamingo.ai.hybridrag.service.rag.graph.GraphRetrievalResult;
import com.flamingo.ai.hybridrag.service.rag.guard.ConfidenceReport;
import com.flamingo.ai.hybridrag.service.rag.retrieval.ScoredChunk;
import java.util.List;

/**
 * Final result of one pipeline invocation. Never modified after assembly.
 *
 * @param text the accepted answer, or the canonical refusal when rejected
 * @param confidence guard report
 * @param queryType the classified type
 * @param sources vector hits that were part of the context, in retrieval order
 * @param kgContext graph signal used for the answer, empty when the graph did not contribute
 * @param reasoningSteps ordered log of pipeline decisions
 */
public record Answer(
    String text,
    ConfidenceReport confidence,
    QueryType queryType,
    List<ScoredChunk> sources,
    GraphRetrievalResult kgContext,
    List<String> reasoningSteps) {

  public Answer {
    sources = List.copyOf(sources);
    reasoningSteps = List.copyOf(reasoningSteps);
  }
}
