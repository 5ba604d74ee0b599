package com.flamingo.ai.hybridrag.service.rag.graph;

import com.flamingo.ai.hybridrag.graph.GraphRelation;

/**
 * A relation reached during traversal.
 *
 * @param relation the stored relation
 * @param depth hop at which the relation was first used, starting at 1
 */
public record TraversedRelation(GraphRelation relation, int depth) {}
