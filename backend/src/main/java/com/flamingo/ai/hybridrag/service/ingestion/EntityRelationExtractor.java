package com.flamingo.ai.hybridrag.service.ingestion;

import com.flamingo.ai.hybridrag.graph.DocumentGraph;
import com.flamingo.ai.hybridrag.graph.DocumentGraph.ExtractedEntity;
import com.flamingo.ai.hybridrag.graph.DocumentGraph.ExtractedRelation;
import com.flamingo.ai.hybridrag.graph.EntityNames;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Rule-based entity and relation extraction for plain text.
 *
 * <p>An entity is a capitalized span mentioned at least twice in the document, or one that takes
 * part in a relation pattern. Relations come from three sentence patterns; any other pair of
 * entities sharing a sentence is linked with {@value #RELATED_TO}.
 */
@Component
@Slf4j
public class EntityRelationExtractor {

  static final String IS_A = "IS_A";
  static final String WORKS_AT = "WORKS_AT";
  static final String LOCATED_IN = "LOCATED_IN";
  static final String RELATED_TO = "RELATED_TO";

  static final String ORGANIZATION = "Organization";
  static final String LOCATION = "Location";
  static final String PERSON = "Person";
  static final String ENTITY = "Entity";

  private static final int MAX_ENTITIES = 50;
  private static final int MIN_MENTIONS = 2;

  private static final String NAME = "(" + EntityNames.CAPITALIZED_SPAN_REGEX + ")";

  private static final Map<String, Pattern> RELATION_PATTERNS = new LinkedHashMap<>();

  static {
    RELATION_PATTERNS.put(
        WORKS_AT,
        Pattern.compile(
            "\\b" + NAME + "\\s+(?:works|worked|work|working)\\s+(?:at|for)\\s+" + NAME));
    RELATION_PATTERNS.put(
        LOCATED_IN,
        Pattern.compile(
            "\\b" + NAME + "\\s+(?:(?:is|are|was|were)\\s+)?located\\s+in\\s+" + NAME));
    RELATION_PATTERNS.put(
        IS_A,
        Pattern.compile("\\b" + NAME + "\\s+(?:is|was)\\s+(?:a|an|the)\\s+" + NAME));
  }

  private static final Pattern SENTENCE = Pattern.compile("[^.!?]+");

  private static final Set<String> ORGANIZATION_WORDS =
      Set.of(
          "inc", "corp", "corporation", "company", "ltd", "llc", "organization", "university",
          "college", "school", "institute", "labs", "group");

  private static final Set<String> LOCATION_WORDS =
      Set.of("city", "country", "state", "nation", "republic", "county", "province");

  /** Extracts the entities and relations of one document. */
  public DocumentGraph extract(String documentId, String text) {
    if (text == null || text.isBlank()) {
      return new DocumentGraph(documentId, List.of(), List.of());
    }

    Map<String, Integer> mentions = new HashMap<>();
    for (String span : EntityNames.capitalizedSpans(text)) {
      mentions.merge(span, 1, Integer::sum);
    }

    List<String> sentences = sentences(text);
    Map<String, ExtractedRelation> relations = new LinkedHashMap<>();
    Map<String, String> roleTypes = new HashMap<>();
    for (String sentence : sentences) {
      matchPatterns(sentence, relations, roleTypes);
    }

    Set<String> entityNames = new LinkedHashSet<>();
    for (String span : EntityNames.capitalizedSpans(text)) {
      boolean inRelation = roleTypes.containsKey(span);
      if (inRelation || mentions.getOrDefault(span, 0) >= MIN_MENTIONS) {
        entityNames.add(span);
      }
    }
    List<String> kept = entityNames.stream().limit(MAX_ENTITIES).toList();
    Set<String> keptSet = new LinkedHashSet<>(kept);

    for (String sentence : sentences) {
      linkCoOccurring(sentence, keptSet, relations);
    }

    List<ExtractedEntity> entities = new ArrayList<>(kept.size());
    for (String name : kept) {
      entities.add(new ExtractedEntity(name, classifyType(name, roleTypes.get(name))));
    }
    List<ExtractedRelation> keptRelations =
        relations.values().stream()
            .filter(r -> keptSet.contains(r.sourceName()) && keptSet.contains(r.targetName()))
            .toList();

    log.debug(
        "Extracted {} entities and {} relations from document {}",
        entities.size(),
        keptRelations.size(),
        documentId);
    return new DocumentGraph(documentId, entities, keptRelations);
  }

  private static void matchPatterns(
      String sentence, Map<String, ExtractedRelation> relations, Map<String, String> roleTypes) {
    for (Map.Entry<String, Pattern> entry : RELATION_PATTERNS.entrySet()) {
      String type = entry.getKey();
      Matcher matcher = entry.getValue().matcher(sentence);
      while (matcher.find()) {
        String source = EntityNames.stripLeadingWords(matcher.group(1));
        String target = EntityNames.stripLeadingWords(matcher.group(2));
        if (source.length() <= 2 || target.length() <= 2 || source.equals(target)) {
          continue;
        }
        relations.putIfAbsent(
            key(source, type, target), new ExtractedRelation(source, type, target));
        switch (type) {
          case WORKS_AT -> {
            roleTypes.putIfAbsent(source, PERSON);
            roleTypes.putIfAbsent(target, ORGANIZATION);
          }
          case LOCATED_IN -> {
            roleTypes.putIfAbsent(source, ENTITY);
            roleTypes.put(target, LOCATION);
          }
          default -> {
            roleTypes.putIfAbsent(source, ENTITY);
            roleTypes.putIfAbsent(target, ENTITY);
          }
        }
      }
    }
  }

  private static void linkCoOccurring(
      String sentence, Set<String> entities, Map<String, ExtractedRelation> relations) {
    List<String> present =
        EntityNames.capitalizedSpans(sentence).stream()
            .filter(entities::contains)
            .distinct()
            .toList();
    for (int i = 0; i < present.size(); i++) {
      for (int j = i + 1; j < present.size(); j++) {
        String source = present.get(i);
        String target = present.get(j);
        if (!linked(relations, source, target)) {
          relations.put(
              key(source, RELATED_TO, target), new ExtractedRelation(source, RELATED_TO, target));
        }
      }
    }
  }

  private static boolean linked(
      Map<String, ExtractedRelation> relations, String first, String second) {
    for (ExtractedRelation relation : relations.values()) {
      boolean forward =
          relation.sourceName().equals(first) && relation.targetName().equals(second);
      boolean backward =
          relation.sourceName().equals(second) && relation.targetName().equals(first);
      if (forward || backward) {
        return true;
      }
    }
    return false;
  }

  /** Keyword heuristics win over the role a name plays in a relation. */
  static String classifyType(String name, String roleType) {
    String[] words = name.toLowerCase(Locale.ROOT).split("\\s+");
    for (String word : words) {
      if (ORGANIZATION_WORDS.contains(word)) {
        return ORGANIZATION;
      }
    }
    for (String word : words) {
      if (LOCATION_WORDS.contains(word)) {
        return LOCATION;
      }
    }
    if (roleType != null && !ENTITY.equals(roleType)) {
      return roleType;
    }
    return words.length == 2 ? PERSON : ENTITY;
  }

  private static List<String> sentences(String text) {
    List<String> sentences = new ArrayList<>();
    Matcher matcher = SENTENCE.matcher(text);
    while (matcher.find()) {
      String sentence = matcher.group().strip();
      if (!sentence.isEmpty()) {
        sentences.add(sentence);
      }
    }
    return sentences;
  }

  private static String key(String source, String type, String target) {
    return source + "|" + type + "|" + target;
  }
}
