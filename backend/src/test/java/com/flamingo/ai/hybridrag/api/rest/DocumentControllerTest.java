package com.flamingo.ai.hybridrag.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.hybridrag.api.dto.request.IngestRequest;
import com.flamingo.ai.hybridrag.exception.DocumentProcessingException;
import com.flamingo.ai.hybridrag.exception.GlobalExceptionHandler;
import com.flamingo.ai.hybridrag.service.ingestion.DocumentIngestionService;
import com.flamingo.ai.hybridrag.service.ingestion.IngestionResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
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
@DisplayName("DocumentController Tests")
class DocumentControllerTest {

  @Mock private DocumentIngestionService ingestionService;

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new DocumentController(ingestionService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    objectMapper = new ObjectMapper();
  }

  @Test
  @DisplayName("Should return 201 with ingestion counts")
  void shouldReturnCreated_whenDocumentIngested() throws Exception {
    when(ingestionService.ingest("companies.txt", "John Smith works at Tech Corp.", null))
        .thenReturn(new IngestionResult("doc-1", "companies.txt", 1, 2, 1, true));

    mockMvc
        .perform(
            post("/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    objectMapper.writeValueAsString(
                        IngestRequest.builder()
                            .fileName("companies.txt")
                            .content("John Smith works at Tech Corp.")
                            .build())))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.documentId").value("doc-1"))
        .andExpect(jsonPath("$.chunkCount").value(1))
        .andExpect(jsonPath("$.entityCount").value(2))
        .andExpect(jsonPath("$.relationCount").value(1))
        .andExpect(jsonPath("$.graphWritten").value(true));
  }

  @Test
  void shouldReturn400_whenContentMissing() throws Exception {
    mockMvc
        .perform(
            post("/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fileName\":\"empty.txt\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verifyNoInteractions(ingestionService);
  }

  @Test
  void shouldReturn422_whenProcessingFails() throws Exception {
    when(ingestionService.ingest(anyString(), anyString(), any()))
        .thenThrow(new DocumentProcessingException("doc-1", "Embedding generation failed"));

    mockMvc
        .perform(
            post("/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fileName\":\"a.txt\",\"content\":\"Some text.\"}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("DOCUMENT_003"))
        .andExpect(jsonPath("$.message").value("Failed to process document"));
  }
}
