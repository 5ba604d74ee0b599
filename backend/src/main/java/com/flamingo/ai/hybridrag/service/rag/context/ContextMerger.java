package com.flamingo.ai.hybridrag.service.rag.context;

import com.flamingo.ai.hybridrag.config.RagConfig;
import com.flamingo.ai.hybridrag.domain.enums.QueryType;
import com.flamingo.ai.hybridrag.graph.GraphEntity;
import com.flamingo.ai.hybridrag.service.rag.graph.GraphRetrievalResult;
import com.flamingo.ai.hybridrag.service.rag.graph.TraversedRelation;
import com.flamingo.ai.hybridrag.service.rag.retrieval.ScoredChunk;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fuses vector and graph results into one ordered context.
 *
 * <ul>
 *   <li>FACTUAL: chunks by descending score, then graph blocks.
 *   <li>RELATIONAL: relations by traversal depth, then entity summaries, then chunks.
 *   <li>REASONING: one chunk, one graph block, alternating from the chunk side; the longer source
 *       continues alone once the other runs out.
 * </ul>
 *
 * <p>Graph blocks always list relations (shallowest first, traversal order within a depth) before
 * entities. When the rendered context would exceed the total budget, blocks are dropped from the
 * low-priority end. A block is never cut.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContextMerger {

  private final RagConfig ragConfig;

  public MergedContext merge(
      QueryType queryType, List<ScoredChunk> vectorHits, GraphRetrievalResult graphHits) {
    List<Candidate> vectorBlocks = vectorBlocks(vectorHits);
    List<Candidate> relationBlocks = relationBlocks(graphHits);
    List<Candidate> entityBlocks = entityBlocks(graphHits);

    List<Candidate> ordered = new ArrayList<>();
    switch (queryType) {
      case FACTUAL -> {
        ordered.addAll(vectorBlocks);
        ordered.addAll(relationBlocks);
        ordered.addAll(entityBlocks);
      }
      case RELATIONAL -> {
        ordered.addAll(relationBlocks);
        ordered.addAll(entityBlocks);
        ordered.addAll(vectorBlocks);
      }
      case REASONING -> {
        List<Candidate> graphBlocks = new ArrayList<>(relationBlocks);
        graphBlocks.addAll(entityBlocks);
        ordered.addAll(interleave(vectorBlocks, graphBlocks));
      }
    }

    return applyBudget(ordered);
  }

  private MergedContext applyBudget(List<Candidate> ordered) {
    int budget = ragConfig.getContext().getMaxContextChars();
    List<String> blocks = new ArrayList<>();
    List<BlockSource> provenance = new ArrayList<>();
    int used = 0;
    for (Candidate candidate : ordered) {
      int separator = blocks.isEmpty() ? 0 : MergedContext.BLOCK_SEPARATOR.length();
      int cost = candidate.text().length() + separator;
      if (used + cost > budget) {
        break;
      }
      blocks.add(candidate.text());
      provenance.add(candidate.source());
      used += cost;
    }
    if (blocks.size() < ordered.size()) {
      log.debug(
          "Context budget of {} chars reached, dropped {} of {} blocks",
          budget,
          ordered.size() - blocks.size(),
          ordered.size());
    }
    return new MergedContext(blocks, provenance);
  }

  private static List<Candidate> interleave(List<Candidate> first, List<Candidate> second) {
    List<Candidate> result = new ArrayList<>(first.size() + second.size());
    int i = 0;
    int j = 0;
    while (i < first.size() || j < second.size()) {
      if (i < first.size()) {
        result.add(first.get(i++));
      }
      if (j < second.size()) {
        result.add(second.get(j++));
      }
    }
    return result;
  }

  private List<Candidate> vectorBlocks(List<ScoredChunk> hits) {
    List<Candidate> blocks = new ArrayList<>(hits.size());
    for (ScoredChunk hit : hits) {
      String label =
          hit.chunk().getFileName() != null ? hit.chunk().getFileName() : hit.documentId();
      String text = "[Chunk " + hit.chunkId() + " | " + label + "]\n" + clip(hit.content());
      blocks.add(new Candidate(text, BlockSource.chunk(hit.chunkId())));
    }
    return blocks;
  }

  private List<Candidate> relationBlocks(GraphRetrievalResult graph) {
    return graph.relations().stream()
        .sorted(Comparator.comparingInt(TraversedRelation::depth))
        .map(
            r ->
                new Candidate(
                    clip("[Relation] " + r.relation().describe()),
                    BlockSource.relation(r.relation().key())))
        .toList();
  }

  private List<Candidate> entityBlocks(GraphRetrievalResult graph) {
    List<Candidate> blocks = new ArrayList<>(graph.entities().size());
    for (GraphEntity entity : graph.entities()) {
      String text = clip("[Entity] " + entity.name() + " (Type: " + entity.type() + ")");
      blocks.add(new Candidate(text, BlockSource.entity(entity.id())));
    }
    return blocks;
  }

  /** Limits a block's source text to the per-block budget, preferring a word boundary. */
  private String clip(String text) {
    int max = ragConfig.getContext().getMaxBlockChars();
    if (text == null) {
      return "";
    }
    if (text.length() <= max) {
      return text;
    }
    int cut = text.lastIndexOf(' ', max);
    return text.substring(0, cut > max / 2 ? cut : max);
  }

  private record Candidate(String text, BlockSource source) {}
}
