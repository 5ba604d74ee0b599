package com.flamingo.ai.hybridrag.graph;

import java.util.List;

/** Read and write access to the knowledge graph. */
public interface GraphStore {

  /** Entities whose normalized name equals {@code normalizedName}. */
  List<GraphEntity> matchEntities(String normalizedName);

  /** Entities whose normalized name contains {@code fragment}, in name order. */
  List<GraphEntity> matchEntitiesContaining(String fragment);

  /**
   * Relations touching the entity in either direction, with the entities on their other ends.
   * Ordering is deterministic for an unchanged graph.
   */
  GraphNeighborhood neighbors(String entityId);

  /**
   * Writes a document's entities and relations in a single transaction. Entities merge on
   * normalized name; relations merge on (source, type, target).
   */
  void write(DocumentGraph graph);

  /** Display names of stored entities that occur in {@code text}. */
  List<String> findEntityNamesInText(String text);

  GraphStats stats();
}
