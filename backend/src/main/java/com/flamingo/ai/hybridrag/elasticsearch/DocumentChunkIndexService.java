package com.flamingo.ai.hybridrag.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.hybridrag.service.rag.retrieval.ScoredChunk;
import com.flamingo.ai.hybridrag.service.rag.retrieval.VectorIndex;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch-backed {@link VectorIndex} for document chunks.
 *
 * <p>Embeddings live in a {@code dense_vector} field with cosine similarity, so kNN scores are
 * already normalized to [0,1]. Search, upsert and delete are idempotent and retried through the
 * {@code elasticsearch} retry instance.
 */
@Service
@Slf4j
public class DocumentChunkIndexService extends AbstractElasticsearchIndexService<DocumentChunk>
    implements VectorIndex {

  @Value("${elasticsearch.index-name:hybrid-rag-chunks}")
  private String indexName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int vectorDimensions;

  @Autowired
  public DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  @Timed(value = "vector.index.search", description = "Time for kNN chunk search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "searchFallback")
  @Retry(name = "elasticsearch")
  public List<ScoredChunk> search(List<Float> vector, int k) {
    return vectorSearch(vector, k).stream()
        .map(hit -> new ScoredChunk(hit.document(), hit.score()))
        .toList();
  }

  @SuppressWarnings("unused")
  private List<ScoredChunk> searchFallback(List<Float> vector, int k, Throwable t) {
    log.warn("{} vector search fallback triggered: {}", indexName, t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".vector_search.fallback").increment();
    return List.of();
  }

  @Override
  @Timed(value = "vector.index.upsert", description = "Time to upsert chunks")
  @CircuitBreaker(name = "elasticsearch")
  @Retry(name = "elasticsearch")
  public void upsertAll(List<DocumentChunk> chunks) {
    indexDocuments(chunks);
    refresh();
  }

  @Override
  public long count() {
    return countDocuments();
  }

  @Override
  @Retry(name = "elasticsearch")
  public void deleteByDocument(String documentId) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put("documentId", documentId);
    deleteBy(criteria);
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put("documentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("fileName", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("offset", Property.of(p -> p.integer(i -> i)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(DocumentChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("documentId", chunk.getDocumentId());
    document.put("fileName", chunk.getFileName());
    document.put("chunkIndex", chunk.getChunkIndex());
    document.put("offset", chunk.getOffset());
    document.put("content", chunk.getContent());
    document.put("embedding", chunk.getEmbedding());
    return document;
  }

  @Override
  protected DocumentChunk convertFromDocument(Map<String, Object> source) {
    return DocumentChunk.builder()
        .id((String) source.get("id"))
        .documentId((String) source.get("documentId"))
        .fileName((String) source.get("fileName"))
        .chunkIndex(intValue(source.get("chunkIndex")))
        .offset(intValue(source.get("offset")))
        .content((String) source.get("content"))
        .build();
  }

  private static int intValue(Object value) {
    return value instanceof Number n ? n.intValue() : 0;
  }

  @Override
  protected String getDocumentId(DocumentChunk entity) {
    return entity.getId();
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(List<Float> queryEmbedding, int topK) {
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k ->
                        k.field("embedding")
                            .queryVector(queryEmbedding)
                            .k(topK)
                            .numCandidates(Math.max(topK * 2, 10)))
                .source(src -> src.filter(f -> f.excludes("embedding")))
                .size(topK));
  }

  @Override
  protected Query buildDeleteQuery(Map<String, Object> criteria) {
    Object documentId = criteria.get("documentId");
    if (documentId == null) {
      throw new IllegalArgumentException("deleteBy requires documentId in criteria");
    }
    return Query.of(q -> q.term(t -> t.field("documentId").value(documentId.toString())));
  }

  @Override
  protected String getMetricPrefix() {
    return "document_chunk";
  }
}
