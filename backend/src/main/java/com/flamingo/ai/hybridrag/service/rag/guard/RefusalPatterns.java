package com.flamingo.ai.hybridrag.service.rag.guard;

import java.util.List;
import java.util.Locale;

/** Phrases that mark an answer as a refusal, and the canonical refusal returned to callers. */
public final class RefusalPatterns {

  public static final String INSUFFICIENT_INFORMATION =
      "Insufficient information: the available documents do not contain enough detail to answer"
          + " this question confidently.";

  static final List<String> PHRASES =
      List.of(
          "i cannot answer",
          "i can't answer",
          "i don't know",
          "i do not know",
          "not enough information",
          "cannot determine",
          "unclear from the context",
          "insufficient information",
          "i cannot provide");

  private RefusalPatterns() {}

  /** True for blank answers and answers containing any refusal phrase, ignoring case. */
  public static boolean isRefusal(String answer) {
    if (answer == null || answer.isBlank()) {
      return true;
    }
    String lower = answer.toLowerCase(Locale.ROOT).replace('\u2019', '\'');
    for (String phrase : PHRASES) {
      if (lower.contains(phrase)) {
        return true;
      }
    }
    return false;
  }
}
