package com.flamingo.ai.hybridrag.api.rest;

import com.flamingo.ai.hybridrag.api.dto.request.QueryRequest;
import com.flamingo.ai.hybridrag.api.dto.response.QueryResponse;
import com.flamingo.ai.hybridrag.service.rag.pipeline.Answer;
import com.flamingo.ai.hybridrag.service.rag.pipeline.HybridRagPipeline;
import com.flamingo.ai.hybridrag.service.rag.pipeline.QueryCommand;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for question answering. */
@RestController
@RequestMapping("/query")
@RequiredArgsConstructor
@Slf4j
public class QueryController {

  private final HybridRagPipeline pipeline;

  /**
   * Answers a question. A rejected answer is still a 200 with {@code rejected=true}; capability
   * outages and timeouts map to 503 and 504.
   */
  @PostMapping
  public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
    Answer answer =
        pipeline.answer(
            new QueryCommand(request.getQuestion(), request.isUseHybrid(), request.getTopK()));
    log.info(
        "Answered {} question, verdict={}, sources={}",
        answer.queryType().getLabel(),
        answer.confidence().verdict(),
        answer.sources().size());
    return ResponseEntity.ok(QueryResponse.fromAnswer(answer));
  }
}
