package com.flamingo.ai.hybridrag.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.elasticsearch.DocumentChunk;
import com.flamingo.ai.hybridrag.exception.DocumentProcessingException;
import com.flamingo.ai.hybridrag.graph.DocumentGraph;
import com.flamingo.ai.hybridrag.graph.GraphStore;
import com.flamingo.ai.hybridrag.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.hybridrag.service.rag.retrieval.VectorIndex;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DocumentIngestionServiceTest {

  private static final String CONTENT = "John Smith works at Tech Corp.";
  private static final List<Float> VECTOR = List.of(0.1f, 0.2f);

  @Mock private EmbeddingService embeddingService;
  @Mock private VectorIndex vectorIndex;
  @Mock private GraphStore graphStore;

  private MeterRegistry meterRegistry;
  private DocumentIngestionService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service =
        new DocumentIngestionService(
            new TextChunker(new RagConfig()),
            embeddingService,
            vectorIndex,
            new EntityRelationExtractor(),
            graphStore,
            meterRegistry);
  }

  @Test
  @SuppressWarnings("unchecked")
  void shouldIndexChunksAndWriteGraph() {
    when(embeddingService.embedTexts(List.of(CONTENT))).thenReturn(List.of(VECTOR));

    IngestionResult result = service.ingest("notes.txt", CONTENT, "doc-1");

    ArgumentCaptor<List<DocumentChunk>> chunks = ArgumentCaptor.forClass(List.class);
    verify(vectorIndex).upsertAll(chunks.capture());
    assertThat(chunks.getValue())
        .singleElement()
        .satisfies(
            chunk -> {
              assertThat(chunk.getId()).isEqualTo("doc-1_0");
              assertThat(chunk.getOffset()).isZero();
              assertThat(chunk.getEmbedding()).isEqualTo(VECTOR);
            });
    verify(graphStore).write(any(DocumentGraph.class));
    assertThat(result)
        .isEqualTo(new IngestionResult("doc-1", "notes.txt", 1, 2, 1, true));
  }

  @Test
  void shouldReplaceExistingChunks_whenDocumentIdGiven() {
    when(embeddingService.embedTexts(anyList())).thenReturn(List.of(VECTOR));

    service.ingest("notes.txt", CONTENT, "doc-1");

    InOrder order = inOrder(vectorIndex);
    order.verify(vectorIndex).deleteByDocument("doc-1");
    order.verify(vectorIndex).upsertAll(anyList());
  }

  @Test
  void shouldGenerateId_andSkipDelete_forNewDocument() {
    when(embeddingService.embedTexts(anyList())).thenReturn(List.of(VECTOR));

    IngestionResult result = service.ingest("notes.txt", CONTENT);

    assertThat(result.documentId()).isNotBlank();
    verify(vectorIndex, never()).deleteByDocument(any());
  }

  @Test
  void shouldFail_whenEmbeddingsAreMissing() {
    when(embeddingService.embedTexts(anyList())).thenReturn(List.of());

    assertThatThrownBy(() -> service.ingest("notes.txt", CONTENT, "doc-1"))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageContaining("expected 1 embeddings, got 0");
    verify(vectorIndex, never()).upsertAll(anyList());
    verify(graphStore, never()).write(any());
  }

  @Test
  void shouldFail_whenIndexingFails() {
    when(embeddingService.embedTexts(anyList())).thenReturn(List.of(VECTOR));
    doThrow(new IllegalStateException("bulk failed")).when(vectorIndex).upsertAll(anyList());

    assertThatThrownBy(() -> service.ingest("notes.txt", CONTENT, "doc-1"))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageContaining("bulk failed");
  }

  @Test
  void shouldKeepVectorData_whenGraphWriteFails() {
    when(embeddingService.embedTexts(anyList())).thenReturn(List.of(VECTOR));
    doThrow(new IllegalStateException("neo4j down")).when(graphStore).write(any());

    IngestionResult result = service.ingest("notes.txt", CONTENT, "doc-1");

    assertThat(result.chunkCount()).isEqualTo(1);
    assertThat(result.entityCount()).isZero();
    assertThat(result.relationCount()).isZero();
    assertThat(result.graphWritten()).isFalse();
  }

  @Test
  void shouldRejectBlankContent() {
    assertThatThrownBy(() -> service.ingest("notes.txt", "  "))
        .isInstanceOf(DocumentProcessingException.class);
  }
}
