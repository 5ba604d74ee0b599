package com.flamingo.ai.hybridrag.service.ingestion;

import com.flamingo.ai.hybridrag.elasticsearch.DocumentChunk;
import com.flamingo.ai.hybridrag.exception.DocumentProcessingException;
import com.flamingo.ai.hybridrag.graph.DocumentGraph;
import com.flamingo.ai.hybridrag.graph.GraphStore;
import com.flamingo.ai.hybridrag.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.hybridrag.service.rag.retrieval.VectorIndex;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ingests a plain-text document: chunk, embed, index, then extract and store its graph.
 *
 * <p>Vector indexing must succeed for the document to count as ingested. The graph write is
 * transactional on its own and a failure there only zeroes the graph counts in the result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIngestionService {

  private final TextChunker textChunker;
  private final EmbeddingService embeddingService;
  private final VectorIndex vectorIndex;
  private final EntityRelationExtractor entityRelationExtractor;
  private final GraphStore graphStore;
  private final MeterRegistry meterRegistry;

  public IngestionResult ingest(String fileName, String content) {
    return ingest(fileName, content, null);
  }

  /**
   * Ingests {@code content}, replacing any chunks previously stored under {@code documentId}.
   *
   * @param documentId id to store the document under, or null to generate one
   * @throws DocumentProcessingException when the content is empty or cannot be embedded or indexed
   */
  @Timed(value = "ingestion.document", description = "Time to ingest a document")
  public IngestionResult ingest(String fileName, String content, String documentId) {
    String id =
        documentId == null || documentId.isBlank() ? UUID.randomUUID().toString() : documentId;
    if (content == null || content.isBlank()) {
      throw new DocumentProcessingException(id, "Document content is empty");
    }

    List<TextChunk> textChunks = textChunker.chunk(content);
    log.info("Document {} ({}) split into {} chunks", id, fileName, textChunks.size());

    List<List<Float>> embeddings =
        embeddingService.embedTexts(textChunks.stream().map(TextChunk::content).toList());
    if (embeddings.size() != textChunks.size()
        || embeddings.stream().anyMatch(e -> e == null || e.isEmpty())) {
      meterRegistry.counter("ingestion.documents", "outcome", "embedding_failed").increment();
      throw new DocumentProcessingException(
          id,
          String.format(
              "Embedding generation failed: expected %d embeddings, got %d",
              textChunks.size(), embeddings.size()));
    }

    List<DocumentChunk> chunks = new ArrayList<>(textChunks.size());
    for (int i = 0; i < textChunks.size(); i++) {
      TextChunk textChunk = textChunks.get(i);
      chunks.add(
          DocumentChunk.builder()
              .id(id + "_" + textChunk.index())
              .documentId(id)
              .fileName(fileName)
              .chunkIndex(textChunk.index())
              .offset(textChunk.offset())
              .content(textChunk.content())
              .embedding(embeddings.get(i))
              .build());
    }

    try {
      if (id.equals(documentId)) {
        vectorIndex.deleteByDocument(id);
      }
      vectorIndex.upsertAll(chunks);
    } catch (RuntimeException e) {
      meterRegistry.counter("ingestion.documents", "outcome", "index_failed").increment();
      throw new DocumentProcessingException(id, "Indexing failed: " + e.getMessage(), e);
    }

    DocumentGraph graph = entityRelationExtractor.extract(id, content);
    boolean graphWritten = writeGraph(graph);
    int entityCount = graphWritten ? graph.entities().size() : 0;
    int relationCount = graphWritten ? graph.relations().size() : 0;

    meterRegistry.counter("ingestion.documents", "outcome", "success").increment();
    log.info(
        "Ingested document {}: {} chunks, {} entities, {} relations",
        id,
        chunks.size(),
        entityCount,
        relationCount);
    return new IngestionResult(
        id, fileName, chunks.size(), entityCount, relationCount, graphWritten);
  }

  private boolean writeGraph(DocumentGraph graph) {
    if (graph.isEmpty()) {
      return true;
    }
    try {
      graphStore.write(graph);
      return true;
    } catch (RuntimeException e) {
      log.warn(
          "Graph write failed for document {}, continuing with vector data only: {}",
          graph.documentId(),
          e.getMessage());
      meterRegistry.counter("ingestion.graph.failure").increment();
      return false;
    }
  }
}
