package com.flamingo.ai.hybridrag.domain.enums;

/** Outcome of the hallucination guard. */
public enum Verdict {
  ACCEPT,
  REJECT
}
