package com.flamingo.ai.hybridrag.service.rag.guard;

import com.flamingo.ai.hybridrag.domain.enums.Verdict;

/**
 * Guard outcome for one answer.
 *
 * @param score weighted composite in [0,1]
 * @param components the individual component scores
 * @param verdict accept or reject
 * @param reason why the verdict was reached
 */
public record ConfidenceReport(
    double score, ComponentScores components, Verdict verdict, String reason) {

  public boolean accepted() {
    return verdict == Verdict.ACCEPT;
  }
}
