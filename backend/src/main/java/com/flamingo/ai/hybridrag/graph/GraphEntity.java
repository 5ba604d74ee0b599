package com.flamingo.ai.hybridrag.graph;

import java.util.List;

/**
 * A named node of the knowledge graph.
 *
 * @param id stable store identifier
 * @param name display name as first written
 * @param type coarse category such as Person or Organization
 * @param sourceDocumentIds documents that mention the entity
 */
public record GraphEntity(String id, String name, String type, List<String> sourceDocumentIds) {

  public GraphEntity {
    sourceDocumentIds = sourceDocumentIds == null ? List.of() : List.copyOf(sourceDocumentIds);
  }

  public String normalizedName() {
    return EntityNames.normalize(name);
  }
}
