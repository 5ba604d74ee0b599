package com.flamingo.ai.hybridrag.service.rag.graph;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.graph.EntityNames;
import com.flamingo.ai.hybridrag.graph.GraphStore;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Finds candidate entity names in a question to seed graph traversal.
 *
 * <p>Combines capitalized-token spans with names of stored entities that appear verbatim in the
 * question.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryEntityExtractor {

  private final GraphStore graphStore;
  private final RagConfig ragConfig;

  /** Returns distinct candidate names, capitalized spans first. */
  public List<String> extract(String question) {
    int limit = ragConfig.getGraph().getMaxSeedEntities();
    Set<String> names = new LinkedHashSet<>(EntityNames.capitalizedSpans(question));

    try {
      names.addAll(graphStore.findEntityNamesInText(question));
    } catch (RuntimeException e) {
      log.warn("Known-entity lookup failed, using capitalized spans only: {}", e.getMessage());
    }

    List<String> result = new ArrayList<>(names);
    return result.size() > limit ? result.subList(0, limit) : result;
  }
}
