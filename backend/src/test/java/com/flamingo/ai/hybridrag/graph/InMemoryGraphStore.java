package com.flamingo.ai.hybridrag.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/** {@link GraphStore} held in memory for tests. Ordering mirrors the Neo4j queries. */
public class InMemoryGraphStore implements GraphStore {

  private final Map<String, GraphEntity> entitiesByName = new LinkedHashMap<>();
  private final Map<String, GraphRelation> relationsByKey = new LinkedHashMap<>();
  private final AtomicInteger neighborCalls = new AtomicInteger();

  public GraphEntity addEntity(String name, String type) {
    return entitiesByName.computeIfAbsent(
        EntityNames.normalize(name),
        key -> new GraphEntity("e" + (entitiesByName.size() + 1), name, type, List.of("doc-1")));
  }

  public InMemoryGraphStore relate(String source, String type, String target) {
    GraphEntity s = addEntity(source, "Entity");
    GraphEntity t = addEntity(target, "Entity");
    GraphRelation relation = new GraphRelation(s.id(), t.id(), s.name(), t.name(), type, List.of());
    relationsByKey.putIfAbsent(relation.key(), relation);
    return this;
  }

  public int neighborCalls() {
    return neighborCalls.get();
  }

  @Override
  public List<GraphEntity> matchEntities(String normalizedName) {
    GraphEntity entity = entitiesByName.get(normalizedName);
    return entity == null ? List.of() : List.of(entity);
  }

  @Override
  public List<GraphEntity> matchEntitiesContaining(String fragment) {
    return entitiesByName.entrySet().stream()
        .filter(e -> e.getKey().contains(fragment))
        .sorted(Map.Entry.comparingByKey())
        .map(Map.Entry::getValue)
        .toList();
  }

  @Override
  public GraphNeighborhood neighbors(String entityId) {
    neighborCalls.incrementAndGet();
    List<GraphRelation> relations = new ArrayList<>();
    Map<String, GraphEntity> neighbors = new LinkedHashMap<>();
    relationsByKey.values().stream()
        .filter(r -> r.sourceEntityId().equals(entityId) || r.targetEntityId().equals(entityId))
        .sorted(Comparator.comparing(GraphRelation::relationType).thenComparing(GraphRelation::key))
        .forEach(
            r -> {
              relations.add(r);
              String otherId =
                  r.sourceEntityId().equals(entityId) ? r.targetEntityId() : r.sourceEntityId();
              neighbors.putIfAbsent(otherId, byId(otherId));
            });
    return new GraphNeighborhood(new ArrayList<>(neighbors.values()), relations);
  }

  @Override
  public void write(DocumentGraph graph) {
    graph.entities().forEach(e -> addEntity(e.name(), e.type()));
    graph.relations().forEach(r -> relate(r.sourceName(), r.relationType(), r.targetName()));
  }

  @Override
  public List<String> findEntityNamesInText(String text) {
    String normalized = EntityNames.normalize(text);
    return entitiesByName.entrySet().stream()
        .filter(e -> normalized.contains(e.getKey()))
        .sorted(Map.Entry.comparingByKey())
        .map(e -> e.getValue().name())
        .toList();
  }

  @Override
  public GraphStats stats() {
    return new GraphStats(entitiesByName.size(), relationsByKey.size());
  }

  private GraphEntity byId(String id) {
    return entitiesByName.values().stream()
        .filter(e -> e.id().equals(id))
        .findFirst()
        .orElseThrow();
  }
}
