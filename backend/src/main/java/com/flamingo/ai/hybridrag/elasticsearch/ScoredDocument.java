package com.flamingo.ai.hybridrag.elasticsearch;

/**
 * A document returned by a search together with the raw relevance score Elasticsearch assigned.
 *
 * @param <T> the document type
 */
public record ScoredDocument<T>(T document, double score) {}
