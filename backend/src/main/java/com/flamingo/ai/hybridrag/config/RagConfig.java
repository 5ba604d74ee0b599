package com.flamingo.ai.hybridrag.config;

import com.flamingo.ai.hybridrag.service.rag.pipeline.PipelineSettings;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the hybrid retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Graph graph = new Graph();
  private Context context = new Context();
  private Confidence confidence = new Confidence();
  private Llm llm = new Llm();
  private Pipeline pipeline = new Pipeline();

  @Getter
  @Setter
  public static class Chunking {
    private int chunkSize = 1000;
    private int chunkOverlap = 200;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 5;

    /** Upper bound for a per-request top-k override. */
    private int maxTopK = 20;
  }

  @Getter
  @Setter
  public static class Graph {
    private int maxDepth = 2;
    private int maxSeedEntities = 10;
    private int maxEntities = 25;
    private int maxRelations = 25;
  }

  @Getter
  @Setter
  public static class Context {
    private int maxBlockChars = 1500;
    private int maxContextChars = 6000;
  }

  @Getter
  @Setter
  public static class Confidence {
    private double threshold = 0.4;
    private int minContextLength = 50;
    private int minAnswerLength = 100;
    private Weights weights = new Weights();
  }

  @Getter
  @Setter
  public static class Weights {
    private double sourceQuality = 0.30;
    private double textOverlap = 0.20;
    private double rejectionPhrase = 0.20;
    private double contextCoverage = 0.10;
    private double sourceCount = 0.10;
    private double answerLength = 0.10;
  }

  @Getter
  @Setter
  public static class Llm {
    private int maxAttempts = 2;
    private Duration initialBackoff = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;
  }

  @Getter
  @Setter
  public static class Pipeline {
    private Duration timeout = Duration.ofSeconds(60);
  }

  /** Immutable view of the values the pipeline orchestrator reads, taken after binding. */
  @Bean
  public PipelineSettings pipelineSettings() {
    return new PipelineSettings(
        retrieval.getTopK(),
        retrieval.getMaxTopK(),
        graph.getMaxDepth(),
        pipeline.getTimeout());
  }
}
