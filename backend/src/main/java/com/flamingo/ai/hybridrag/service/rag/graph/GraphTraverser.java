package com.flamingo.ai.hybridrag.service.rag.graph;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.graph.EntityNames;
import com.flamingo.ai.hybridrag.graph.GraphEntity;
import com.flamingo.ai.hybridrag.graph.GraphNeighborhood;
import com.flamingo.ai.hybridrag.graph.GraphRelation;
import com.flamingo.ai.hybridrag.graph.GraphStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Breadth-first expansion of the knowledge graph from seed entity names.
 *
 * <p>Each entity is expanded at most once (visited set keyed by entity id) and expansion stops
 * after {@code maxDepth} hops, so traversal terminates on cyclic graphs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphTraverser {

  private final GraphStore graphStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Expands the graph around the entities named in {@code seedNames}.
   *
   * @param seedNames candidate entity names, duplicates allowed
   * @param maxDepth maximum number of hops from a seed, zero returns the seeds only
   * @return reached entities, traversed relations and their descriptions; empty when no seed
   *     matches a stored entity
   */
  @Timed(value = "rag.retrieval.graph", description = "Time for graph traversal")
  public GraphRetrievalResult traverse(Collection<String> seedNames, int maxDepth) {
    if (maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must not be negative, got " + maxDepth);
    }
    int maxEntities = ragConfig.getGraph().getMaxEntities();
    int maxRelations = ragConfig.getGraph().getMaxRelations();

    Map<String, GraphEntity> visited = new LinkedHashMap<>();
    for (GraphEntity seed : resolveSeeds(seedNames)) {
      if (visited.size() >= maxEntities) {
        break;
      }
      visited.putIfAbsent(seed.id(), seed);
    }
    if (visited.isEmpty()) {
      log.debug("No graph entity matches seeds {}", seedNames);
      meterRegistry.counter("rag.retrieval.graph.no_match").increment();
      return GraphRetrievalResult.EMPTY;
    }

    Set<String> relationKeys = new HashSet<>();
    List<TraversedRelation> relations = new ArrayList<>();
    List<String> path = new ArrayList<>();
    List<GraphEntity> frontier = new ArrayList<>(visited.values());

    for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
      List<GraphEntity> next = new ArrayList<>();
      for (GraphEntity current : frontier) {
        if (Thread.currentThread().isInterrupted()) {
          throw new CancellationException("Graph traversal cancelled");
        }
        if (relations.size() >= maxRelations) {
          break;
        }
        GraphNeighborhood neighborhood = graphStore.neighbors(current.id());
        Map<String, GraphEntity> neighborsById = new HashMap<>();
        neighborhood.entities().forEach(e -> neighborsById.putIfAbsent(e.id(), e));

        for (GraphRelation relation : neighborhood.relations()) {
          if (relations.size() >= maxRelations) {
            break;
          }
          String otherId =
              current.id().equals(relation.sourceEntityId())
                  ? relation.targetEntityId()
                  : relation.sourceEntityId();
          if (!visited.containsKey(otherId)) {
            GraphEntity other = neighborsById.get(otherId);
            if (other == null || visited.size() >= maxEntities) {
              continue;
            }
            visited.put(otherId, other);
            next.add(other);
          }
          if (relationKeys.add(relation.key())) {
            relations.add(new TraversedRelation(relation, depth));
            path.add(relation.describe());
          }
        }
      }
      frontier = next;
    }

    log.debug(
        "Graph traversal from {} reached {} entities over {} relations",
        seedNames,
        visited.size(),
        relations.size());
    meterRegistry.counter("rag.retrieval.graph.relations").increment(relations.size());
    return new GraphRetrievalResult(new ArrayList<>(visited.values()), relations, path);
  }

  /** Exact normalized-name match first, substring match only for names with no exact hit. */
  private List<GraphEntity> resolveSeeds(Collection<String> seedNames) {
    Set<String> normalized = new LinkedHashSet<>();
    for (String name : seedNames) {
      String key = EntityNames.normalize(name);
      if (!key.isEmpty()) {
        normalized.add(key);
      }
    }

    List<GraphEntity> seeds = new ArrayList<>();
    for (String name : normalized) {
      List<GraphEntity> matches = graphStore.matchEntities(name);
      if (matches.isEmpty()) {
        matches = graphStore.matchEntitiesContaining(name);
      }
      seeds.addAll(matches);
    }
    return seeds;
  }
}
