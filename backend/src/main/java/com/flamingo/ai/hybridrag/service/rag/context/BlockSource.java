package com.flamingo.ai.hybridrag.service.rag.context;

/**
 * Where a context block came from.
 *
 * @param kind the source kind
 * @param reference chunk id, relation key or entity id depending on {@code kind}
 */
public record BlockSource(Kind kind, String reference) {

  public enum Kind {
    CHUNK,
    RELATION,
    ENTITY
  }

  public static BlockSource chunk(String chunkId) {
    return new BlockSource(Kind.CHUNK, chunkId);
  }

  public static BlockSource relation(String relationKey) {
    return new BlockSource(Kind.RELATION, relationKey);
  }

  public static BlockSource entity(String entityId) {
    return new BlockSource(Kind.ENTITY, entityId);
  }

  public boolean isGraph() {
    return kind != Kind.CHUNK;
  }
}
