package com.flamingo.ai.hybridrag.service.rag.context;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered context blocks with their provenance. Block order is priority order.
 *
 * @param blocks rendered text of each block
 * @param provenance source of each block, index-aligned with {@code blocks}
 */
public record MergedContext(List<String> blocks, List<BlockSource> provenance) {

  static final String BLOCK_SEPARATOR = "\n\n";

  public static final MergedContext EMPTY = new MergedContext(List.of(), List.of());

  public MergedContext {
    blocks = List.copyOf(blocks);
    provenance = List.copyOf(provenance);
    if (blocks.size() != provenance.size()) {
      throw new IllegalArgumentException(
          "Provenance size " + provenance.size() + " does not match block count " + blocks.size());
    }
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }

  public int size() {
    return blocks.size();
  }

  /** The context as sent to the language model. */
  public String render() {
    return String.join(BLOCK_SEPARATOR, blocks);
  }

  public int totalLength() {
    return render().length();
  }

  /** Ids of the chunks that made it into the context, in block order. */
  public Set<String> chunkIds() {
    Set<String> ids = new LinkedHashSet<>();
    for (BlockSource source : provenance) {
      if (source.kind() == BlockSource.Kind.CHUNK) {
        ids.add(source.reference());
      }
    }
    return ids;
  }
}
