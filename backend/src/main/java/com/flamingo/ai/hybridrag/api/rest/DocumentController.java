package com.flamingo.ai.hybridrag.api.rest;

import com.flamingo.ai.hybridrag.api.dto.request.IngestRequest;
import com.flamingo.ai.hybridrag.api.dto.response.IngestResponse;
import com.flamingo.ai.hybridrag.service.ingestion.DocumentIngestionService;
import com.flamingo.ai.hybridrag.service.ingestion.IngestionResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document ingestion. */
@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentIngestionService ingestionService;

  /** Ingests a plain-text document into the vector index and the knowledge graph. */
  @PostMapping
  public ResponseEntity<IngestResponse> ingest(@Valid @RequestBody IngestRequest request) {
    IngestionResult result =
        ingestionService.ingest(
            request.getFileName(), request.getContent(), request.getDocumentId());
    return ResponseEntity.status(HttpStatus.CREATED).body(IngestResponse.fromResult(result));
  }
}
