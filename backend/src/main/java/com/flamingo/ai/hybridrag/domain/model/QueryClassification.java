package com.flamingo.ai.hybridrag.domain.model;

import com.flamingo.ai.hybridrag.domain.enums.QueryType;

/**
 * Result of classifying a question.
 *
 * @param queryType the assigned type, never null
 * @param rationale how the type was obtained, including any fallback
 * @param fallback whether the default type was used because no label could be determined
 */
public record QueryClassification(QueryType queryType, String rationale, boolean fallback) {

  public static QueryClassification of(QueryType queryType, String rationale) {
    return new QueryClassification(queryType, rationale, false);
  }

  public static QueryClassification fallback(String rationale) {
    return new QueryClassification(QueryType.DEFAULT, rationale, true);
  }
}
