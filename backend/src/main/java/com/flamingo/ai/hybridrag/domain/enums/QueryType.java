package com.flamingo.ai.hybridrag.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Query type assigned by the classifier. Drives graph gating and context ordering. */
public enum QueryType {
  /** Direct fact lookup. Vector context leads. */
  FACTUAL("factual"),

  /** Questions about connections between entities. Graph relations lead. */
  RELATIONAL("relational"),

  /** Multi-step questions that combine facts. Vector and graph context are interleaved. */
  REASONING("reasoning");

  /** Type used whenever a label cannot be determined. */
  public static final QueryType DEFAULT = FACTUAL;

  private final String label;

  QueryType(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  /** Whether graph traversal contributes to this type of query. */
  public boolean usesGraph() {
    return this != FACTUAL;
  }

  /**
   * Resolves an already-normalized label.
   *
   * @param label lower-case label without surrounding whitespace or punctuation
   * @return the matching type, or empty when the label is unknown
   */
  public static Optional<QueryType> fromLabel(String label) {
    if (label == null) {
      return Optional.empty();
    }
    String candidate = label.toLowerCase(Locale.ROOT);
    for (QueryType type : values()) {
      if (type.label.equals(candidate)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
