package com.flamingo.ai.hybridrag.service.rag.pipeline;

/**
 * One question to answer.
 *
 * @param question the natural-language question
 * @param useHybrid whether graph traversal may contribute
 * @param topK vector hit override, or null for the configured default
 */
public record QueryCommand(String question, boolean useHybrid, Integer topK) {

  public static QueryCommand of(String question) {
    return new QueryCommand(question, true, null);
  }
}
