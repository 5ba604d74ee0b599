package com.flamingo.ai.hybridrag.graph;

import java.util.List;

/**
 * Relations incident to one entity, in either direction, together with the entities at their far
 * ends.
 */
public record GraphNeighborhood(List<GraphEntity> entities, List<GraphRelation> relations) {

  public static final GraphNeighborhood EMPTY = new GraphNeighborhood(List.of(), List.of());

  public GraphNeighborhood {
    entities = List.copyOf(entities);
    relations = List.copyOf(relations);
  }
}
