package com.flamingo.ai.hybridrag.service.health;

import com.flamingo.ai.hybridrag.api.dto.response.HealthResponse;
import com.flamingo.ai.hybridrag.graph.GraphStats;
import com.flamingo.ai.hybridrag.graph.GraphStore;
import com.flamingo.ai.hybridrag.service.rag.retrieval.VectorIndex;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** Implementation of HealthService backed by the vector index and the graph store. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthServiceImpl implements HealthService {

  private final VectorIndex vectorIndex;
  private final GraphStore graphStore;

  @Value("${langchain4j.openai.api-key:}")
  private String apiKey;

  @Override
  @Timed(value = "health.status", description = "Time to probe backing stores")
  public HealthResponse getSystemStatus() {
    long totalChunks = -1;
    boolean vectorUp = false;
    try {
      totalChunks = vectorIndex.count();
      vectorUp = totalChunks >= 0;
    } catch (RuntimeException e) {
      log.warn("Vector store unreachable: {}", e.getMessage());
    }

    GraphStats graphStats = new GraphStats(0, 0);
    boolean graphUp = false;
    try {
      graphStats = graphStore.stats();
      graphUp = true;
    } catch (RuntimeException e) {
      log.warn("Graph store unreachable: {}", e.getMessage());
    }

    return HealthResponse.builder()
        .status(vectorUp && graphUp ? HealthResponse.UP : HealthResponse.DEGRADED)
        .vectorStore(vectorUp)
        .graphStore(graphUp)
        .llmConfigured(apiKey != null && !apiKey.isBlank() && !apiKey.startsWith("${"))
        .totalChunks(totalChunks)
        .totalEntities(graphStats.entityCount())
        .totalRelations(graphStats.relationCount())
        .timestamp(LocalDateTime.now())
        .build();
  }
}
