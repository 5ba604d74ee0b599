package com.flamingo.ai.hybridrag.graph;

import java.util.List;

/**
 * A directed edge between two entities.
 *
 * <p>The endpoint names travel with the relation so it can be rendered without another lookup.
 */
public record GraphRelation(
    String sourceEntityId,
    String targetEntityId,
    String sourceName,
    String targetName,
    String relationType,
    List<String> sourceDocumentIds) {

  public GraphRelation {
    sourceDocumentIds = sourceDocumentIds == null ? List.of() : List.copyOf(sourceDocumentIds);
  }

  /** Identity used for deduplication: (source, type, target). */
  public String key() {
    return sourceEntityId + "|" + relationType + "|" + targetEntityId;
  }

  /** Human-readable hop, e.g. {@code John Smith --[WORKS_AT]--> Tech Corp}. */
  public String describe() {
    return sourceName + " --[" + relationType + "]--> " + targetName;
  }
}
