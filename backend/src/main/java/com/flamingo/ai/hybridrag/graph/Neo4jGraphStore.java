package com.flamingo.ai.hybridrag.graph;

import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.Value;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Relationship;
import org.springframework.stereotype.Repository;

/**
 * {@link GraphStore} on Neo4j.
 *
 * <p>Entities are {@code :Entity} nodes keyed by {@code normalizedName}. Every relation is a
 * {@code :RELATES} relationship whose {@code type} property holds the relation type, so relation
 * types never end up interpolated into Cypher.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class Neo4jGraphStore implements GraphStore {

  private static final int SUBSTRING_MATCH_LIMIT = 10;
  private static final int TEXT_MATCH_LIMIT = 20;
  private static final int MAX_NAME_WORDS = 4;

  private final Driver driver;
  private final MeterRegistry meterRegistry;

  @PostConstruct
  void createConstraints() {
    try (Session session = driver.session()) {
      if (session == null) {
        log.warn("Neo4j driver not available, skipping constraint creation");
        return;
      }
      session.executeWrite(
          tx ->
              tx.run(
                      "CREATE CONSTRAINT entity_normalized_name IF NOT EXISTS "
                          + "FOR (e:Entity) REQUIRE e.normalizedName IS UNIQUE")
                  .consume());
      log.info("Neo4j entity constraint verified");
    } catch (Exception e) {
      log.warn("Could not create Neo4j constraints, graph features degrade: {}", e.getMessage());
    }
  }

  @Override
  public List<GraphEntity> matchEntities(String normalizedName) {
    try (Session session = driver.session()) {
      return session.executeRead(
          tx ->
              tx.run(
                      "MATCH (e:Entity {normalizedName: $name}) RETURN e",
                      Map.of("name", normalizedName))
                  .list(r -> toEntity(r.get("e").asNode())));
    }
  }

  @Override
  public List<GraphEntity> matchEntitiesContaining(String fragment) {
    try (Session session = driver.session()) {
      return session.executeRead(
          tx ->
              tx.run(
                      "MATCH (e:Entity) WHERE e.normalizedName CONTAINS $fragment "
                          + "RETURN e ORDER BY e.normalizedName LIMIT $limit",
                      Map.of("fragment", fragment, "limit", SUBSTRING_MATCH_LIMIT))
                  .list(r -> toEntity(r.get("e").asNode())));
    }
  }

  @Override
  @Timed(value = "graph.neighbors", description = "Time to expand one entity")
  public GraphNeighborhood neighbors(String entityId) {
    try (Session session = driver.session()) {
      List<Record> records =
          session.executeRead(
              tx ->
                  tx.run(
                          "MATCH (e:Entity)-[r:RELATES]-(n:Entity) WHERE elementId(e) = $id "
                              + "RETURN r, startNode(r) AS s, endNode(r) AS t, n "
                              + "ORDER BY r.type, n.normalizedName, elementId(r)",
                          Map.of("id", entityId))
                      .list());
      Map<String, GraphEntity> entities = new LinkedHashMap<>();
      List<GraphRelation> relations = new ArrayList<>();
      for (Record record : records) {
        GraphEntity neighbor = toEntity(record.get("n").asNode());
        entities.putIfAbsent(neighbor.id(), neighbor);
        relations.add(
            toRelation(
                record.get("r").asRelationship(),
                record.get("s").asNode(),
                record.get("t").asNode()));
      }
      return new GraphNeighborhood(new ArrayList<>(entities.values()), relations);
    }
  }

  @Override
  @Timed(value = "graph.write", description = "Time to write a document graph")
  public void write(DocumentGraph graph) {
    if (graph.isEmpty()) {
      return;
    }
    List<Map<String, Object>> entityParams = new ArrayList<>();
    for (DocumentGraph.ExtractedEntity entity : graph.entities()) {
      entityParams.add(
          Map.of(
              "normalizedName", EntityNames.normalize(entity.name()),
              "name", entity.name(),
              "type", entity.type()));
    }
    List<Map<String, Object>> relationParams = new ArrayList<>();
    for (DocumentGraph.ExtractedRelation relation : graph.relations()) {
      relationParams.add(
          Map.of(
              "source", EntityNames.normalize(relation.sourceName()),
              "target", EntityNames.normalize(relation.targetName()),
              "type", relation.relationType()));
    }

    try (Session session = driver.session()) {
      session.executeWrite(
          tx -> {
            tx.run(
                    "UNWIND $entities AS ent "
                        + "MERGE (e:Entity {normalizedName: ent.normalizedName}) "
                        + "ON CREATE SET e.name = ent.name, e.type = ent.type, "
                        + "e.sourceDocumentIds = [$documentId] "
                        + "ON MATCH SET e.sourceDocumentIds = CASE "
                        + "WHEN $documentId IN e.sourceDocumentIds THEN e.sourceDocumentIds "
                        + "ELSE e.sourceDocumentIds + $documentId END",
                    Map.of("entities", entityParams, "documentId", graph.documentId()))
                .consume();
            tx.run(
                    "UNWIND $relations AS rel "
                        + "MATCH (s:Entity {normalizedName: rel.source}) "
                        + "MATCH (t:Entity {normalizedName: rel.target}) "
                        + "MERGE (s)-[r:RELATES {type: rel.type}]->(t) "
                        + "ON CREATE SET r.sourceDocumentIds = [$documentId] "
                        + "ON MATCH SET r.sourceDocumentIds = CASE "
                        + "WHEN $documentId IN r.sourceDocumentIds THEN r.sourceDocumentIds "
                        + "ELSE r.sourceDocumentIds + $documentId END",
                    Map.of("relations", relationParams, "documentId", graph.documentId()))
                .consume();
            return null;
          });
    }
    meterRegistry.counter("graph.entities.written").increment(graph.entities().size());
    meterRegistry.counter("graph.relations.written").increment(graph.relations().size());
    log.debug(
        "Wrote {} entities and {} relations for document {}",
        graph.entities().size(),
        graph.relations().size(),
        graph.documentId());
  }

  @Override
  public List<String> findEntityNamesInText(String text) {
    List<String> candidates = candidatePhrases(text);
    if (candidates.isEmpty()) {
      return List.of();
    }
    try (Session session = driver.session()) {
      return session.executeRead(
          tx ->
              tx.run(
                      "MATCH (e:Entity) WHERE e.normalizedName IN $candidates "
                          + "RETURN e.name AS name "
                          + "ORDER BY e.normalizedName LIMIT $limit",
                      Map.of("candidates", candidates, "limit", TEXT_MATCH_LIMIT))
                  .list(r -> r.get("name").asString()));
    }
  }

  @Override
  public GraphStats stats() {
    try (Session session = driver.session()) {
      long entities =
          session.executeRead(
              tx -> tx.run("MATCH (e:Entity) RETURN count(e) AS c").single().get("c").asLong());
      long relations =
          session.executeRead(
              tx ->
                  tx.run("MATCH (:Entity)-[r:RELATES]->(:Entity) RETURN count(r) AS c")
                      .single()
                      .get("c")
                      .asLong());
      return new GraphStats(entities, relations);
    }
  }

  /** Word n-grams of the text (up to four words), normalized like stored entity names. */
  static List<String> candidatePhrases(String text) {
    String[] words = EntityNames.normalize(text.replaceAll("[^\\p{L}\\p{N}\\s'-]", " ")).split(" ");
    Set<String> phrases = new LinkedHashSet<>();
    for (int start = 0; start < words.length; start++) {
      StringBuilder phrase = new StringBuilder();
      for (int len = 0; len < MAX_NAME_WORDS && start + len < words.length; len++) {
        if (len > 0) {
          phrase.append(' ');
        }
        phrase.append(words[start + len]);
        if (phrase.length() > 2) {
          phrases.add(phrase.toString());
        }
      }
    }
    return new ArrayList<>(phrases);
  }

  private static GraphEntity toEntity(Node node) {
    return new GraphEntity(
        node.elementId(),
        node.get("name").asString(),
        stringOr(node.get("type"), "Entity"),
        stringList(node.get("sourceDocumentIds")));
  }

  private static GraphRelation toRelation(Relationship relationship, Node source, Node target) {
    return new GraphRelation(
        source.elementId(),
        target.elementId(),
        source.get("name").asString(),
        target.get("name").asString(),
        relationship.get("type").asString(),
        stringList(relationship.get("sourceDocumentIds")));
  }

  private static String stringOr(Value value, String fallback) {
    return value == null || value.isNull() ? fallback : value.asString();
  }

  private static List<String> stringList(Value value) {
    return value == null || value.isNull() ? List.of() : value.asList(Value::asString);
  }
}
