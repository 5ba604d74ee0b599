package com.flamingo.ai.hybridrag.service.rag.graph;

import com.flamingo.ai.hybridrag.graph.GraphEntity;
import java.util.List;

/**
 * Graph signal for one question.
 *
 * @param entities seed entities followed by reached entities, in discovery order
 * @param relations relations in the order they were traversed, which is non-decreasing in depth
 * @param traversalPath human-readable hop descriptions, aligned with {@code relations}
 */
public record GraphRetrievalResult(
    List<GraphEntity> entities, List<TraversedRelation> relations, List<String> traversalPath) {

  public static final GraphRetrievalResult EMPTY =
      new GraphRetrievalResult(List.of(), List.of(), List.of());

  public GraphRetrievalResult {
    entities = List.copyOf(entities);
    relations = List.copyOf(relations);
    traversalPath = List.copyOf(traversalPath);
  }

  public boolean isEmpty() {
    return entities.isEmpty() && relations.isEmpty();
  }
}
