package com.flamingo.ai.hybridrag.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for Elasticsearch index services.
 *
 * <p>Provides index creation, bulk indexing, kNN search and deletion. Subclasses define the
 * document schema and the conversion between documents and Elasticsearch source maps.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  /**
   * Converts an Elasticsearch source map back to a document. The map contains the hit's {@code
   * _id} under the key {@code id}.
   */
  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  protected abstract SearchRequest buildVectorSearchRequest(List<Float> queryEmbedding, int topK);

  protected abstract Query buildDeleteQuery(Map<String, Object> criteria);

  /**
   * Returns the metric prefix for this index (e.g., "document_chunk").
   *
   * @return the metric prefix
   */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        log.debug("Elasticsearch index '{}' already exists", getIndexName());
      }
    } catch (Exception e) {
      // The service starts without the index; queries fall back to empty vector results.
      log.warn(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage());
      meterRegistry.counter(getMetricPrefix() + ".init.errors").increment();
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  @Override
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }

    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (T document : documents) {
        String id = getDocumentId(document);
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        log.warn("Some documents failed to index in {}: {}", getIndexName(), response.items());
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        throw new IllegalStateException("Bulk indexing into " + getIndexName() + " had errors");
      }
      log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
    } catch (IOException e) {
      log.error("Failed to index documents to {}: {}", getIndexName(), e.getMessage(), e);
      throw new RuntimeException("Failed to index documents", e);
    }
  }

  @Override
  public List<ScoredDocument<T>> vectorSearch(List<Float> queryEmbedding, int topK) {
    try {
      SearchRequest request = buildVectorSearchRequest(queryEmbedding, topK);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<ScoredDocument<T>> results = mapHits(response.hits().hits());
      log.debug(
          "[vectorSearch] index={} topK={} returned={}", getIndexName(), topK, results.size());
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return results;
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new RuntimeException("Vector search failed", e);
    }
  }

  @Override
  public void deleteBy(Map<String, Object> criteria) {
    try {
      Query deleteQuery = buildDeleteQuery(criteria);
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(deleteQuery));
      elasticsearchClient.deleteByQuery(request);
      log.info("Deleted documents from {} with criteria: {}", getIndexName(), criteria);
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
    } catch (IOException e) {
      log.error(
          "Failed to delete documents from {} with criteria {}: {}",
          getIndexName(),
          criteria,
          e.getMessage(),
          e);
      throw new RuntimeException("Failed to delete documents", e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Refreshed index: {}", getIndexName());
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", getIndexName(), e.getMessage());
    }
  }

  @Override
  public long countDocuments() {
    try {
      return elasticsearchClient.count(c -> c.index(getIndexName())).count();
    } catch (IOException e) {
      throw new RuntimeException("Failed to count documents in " + getIndexName(), e);
    }
  }

  @SuppressWarnings("unchecked")
  private List<ScoredDocument<T>> mapHits(List<Hit<Map>> hits) {
    List<ScoredDocument<T>> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source == null) {
        continue;
      }
      // _id is metadata and not part of _source
      source.put("id", hit.id());
      double score = hit.score() != null ? hit.score() : 0.0;
      documents.add(new ScoredDocument<>(convertFromDocument(source), score));
    }
    return documents;
  }
}
