package com.flamingo.ai.hybridrag.api.dto.response;

import com.flamingo.ai.hybridrag.graph.GraphEntity;
import com.flamingo.ai.hybridrag.service.rag.graph.GraphRetrievalResult;
import com.flamingo.ai.hybridrag.service.rag.graph.TraversedRelation;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the graph signal behind an answer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KgContextResponse {

  private List<EntityView> entities;
  private List<RelationView> relations;
  private List<String> traversalPath;

  public static KgContextResponse fromResult(GraphRetrievalResult result) {
    return KgContextResponse.builder()
        .entities(result.entities().stream().map(EntityView::from).toList())
        .relations(result.relations().stream().map(RelationView::from).toList())
        .traversalPath(result.traversalPath())
        .build();
  }

  /** An entity reached during traversal. */
  public record EntityView(String name, String type) {
    static EntityView from(GraphEntity entity) {
      return new EntityView(entity.name(), entity.type());
    }
  }

  /** A traversed relation and the hop at which it was reached. */
  public record RelationView(String source, String type, String target, int depth) {
    static RelationView from(TraversedRelation traversed) {
      return new RelationView(
          traversed.relation().sourceName(),
          traversed.relation().relationType(),
          traversed.relation().targetName(),
          traversed.depth());
    }
  }
}
