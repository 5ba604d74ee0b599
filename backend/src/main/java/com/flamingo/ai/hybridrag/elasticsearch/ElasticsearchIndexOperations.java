package com.flamingo.ai.hybridrag.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * Generic interface for Elasticsearch index operations.
 *
 * @param <T> the document type stored in the index
 */
public interface ElasticsearchIndexOperations<T> {

  /** Creates the index with the implementation's mappings if it does not exist yet. */
  void initIndex();

  /**
   * Indexes multiple documents in bulk. Documents with an existing id are replaced.
   *
   * @param documents the documents to index
   */
  void indexDocuments(List<T> documents);

  /**
   * Performs k-nearest-neighbour search over the embedding field.
   *
   * @param queryEmbedding the query vector
   * @param topK number of results to return
   * @return matching documents in the order returned by Elasticsearch
   */
  List<ScoredDocument<T>> vectorSearch(List<Float> queryEmbedding, int topK);

  /**
   * Deletes documents matching the given criteria.
   *
   * @param criteria key-value pairs for filtering documents to delete
   */
  void deleteBy(Map<String, Object> criteria);

  /** Makes recent writes visible to search. */
  void refresh();

  /** Number of documents currently in the index. */
  long countDocuments();

  String getIndexName();
}
