package com.flamingo.ai.hybridrag.graph;

import java.util.List;

/**
 * Entities and relations extracted from one document, written to the store as a unit.
 *
 * @param documentId the document the facts came from
 * @param entities extracted entities, merged into the store by normalized name
 * @param relations extracted relations referencing entities by name
 */
public record DocumentGraph(
    String documentId, List<ExtractedEntity> entities, List<ExtractedRelation> relations) {

  public DocumentGraph {
    entities = List.copyOf(entities);
    relations = List.copyOf(relations);
  }

  public boolean isEmpty() {
    return entities.isEmpty() && relations.isEmpty();
  }

  /** An entity mention prior to storage. */
  public record ExtractedEntity(String name, String type) {}

  /** A relation prior to storage, with endpoints identified by name. */
  public record ExtractedRelation(String sourceName, String relationType, String targetName) {}
}
