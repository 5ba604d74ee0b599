package com.flamingo.ai.hybridrag.service.rag.guard;

import java.util.LinkedHashMap;
import java.util.Map;

/** The six guard components, each in [0,1]. */
public record ComponentScores(
    double sourceQuality,
    double textOverlap,
    double rejectionPhrase,
    double contextCoverage,
    double sourceCount,
    double answerLength) {

  /** Component values keyed by name, in weight order. */
  public Map<String, Double> asMap() {
    Map<String, Double> map = new LinkedHashMap<>();
    map.put("sourceQuality", sourceQuality);
    map.put("textOverlap", textOverlap);
    map.put("rejectionPhrase", rejectionPhrase);
    map.put("contextCoverage", contextCoverage);
    map.put("sourceCount", sourceCount);
    map.put("answerLength", answerLength);
    return map;
  }
}
