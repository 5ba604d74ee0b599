package com.flamingo.ai.hybridrag.service.rag.guard;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RefusalPatternsTest {

  @ParameterizedTest
  @ValueSource(
      strings = {
        "I cannot provide an answer based on the context.",
        "I don’t know which office John Smith works at.",
        "There is not enough information to say.",
        "Insufficient information in the documents.",
        "   "
      })
  void shouldDetectRefusal(String answer) {
    assertThat(RefusalPatterns.isRefusal(answer)).isTrue();
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "The vendor cannot provide refunds after 30 days.",
        "Tech Corp is located in Berlin.",
        "Suppliers that cannot provide certificates are excluded."
      })
  void shouldAcceptGroundedStatements(String answer) {
    assertThat(RefusalPatterns.isRefusal(answer)).isFalse();
  }

}
