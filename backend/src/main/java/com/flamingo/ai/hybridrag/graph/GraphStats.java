package com.flamingo.ai.hybridrag.graph;

/** Size of the knowledge graph. */
public record GraphStats(long entityCount, long relationCount) {}
