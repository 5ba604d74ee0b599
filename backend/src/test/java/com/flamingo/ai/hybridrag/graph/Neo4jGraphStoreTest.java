package com.flamingo.ai.hybridrag.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.neo4j.driver.Driver;

@ExtendWith(MockitoExtension.class)
class Neo4jGraphStoreTest {

  @Mock private Driver driver;

  @Test
  void shouldBuildNormalizedWordNgrams() {
    assertThat(Neo4jGraphStore.candidatePhrases("Where is  Tech Corp?"))
        .contains("tech corp", "where is tech corp", "tech", "corp")
        .doesNotContain("is", "Tech Corp");
  }

  @Test
  void shouldCapPhrasesAtFourWords() {
    assertThat(Neo4jGraphStore.candidatePhrases("one two three four five"))
        .contains("one two three four", "two three four five")
        .doesNotContain("one two three four five");
  }

  @Test
  void shouldNotQueryStore_whenTextHasNoCandidates() {
    Neo4jGraphStore store = new Neo4jGraphStore(driver, new SimpleMeterRegistry());

    assertThat(store.findEntityNamesInText("?!")).isEmpty();
    verifyNoInteractions(driver);
  }
}
