package com.flamingo.ai.hybridrag.service.rag.pipeline;

import com.flamingo.ai.hybridrag.domain.enums.PipelineStage;
import com.flamingo.ai.hybridrag.domain.enums.QueryType;
import com.flamingo.ai.hybridrag.domain.model.QueryClassification;
import com.flamingo.ai.hybridrag.exception.InvalidQuestionException;
import com.flamingo.ai.hybridrag.exception.PipelineTimeoutException;
import com.flamingo.ai.hybridrag.service.rag.classification.QueryClassifier;
import com.flamingo.ai.hybridrag.service.rag.context.ContextMerger;
import com.flamingo.ai.hybridrag.service.rag.context.MergedContext;
import com.flamingo.ai.hybridrag.service.rag.generation.AnswerGenerator;
import com.flamingo.ai.hybridrag.service.rag.graph.GraphRetrievalResult;
import com.flamingo.ai.hybridrag.service.rag.graph.GraphTraverser;
import com.flamingo.ai.hybridrag.service.rag.graph.QueryEntityExtractor;
import com.flamingo.ai.hybridrag.service.rag.guard.ConfidenceReport;
import com.flamingo.ai.hybridrag.service.rag.guard.HallucinationGuard;
import com.flamingo.ai.hybridrag.service.rag.guard.RefusalPatterns;
import com.flamingo.ai.hybridrag.service.rag.retrieval.ScoredChunk;
import com.flamingo.ai.hybridrag.service.rag.retrieval.VectorRetriever;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Answers one question end to end: classify, retrieve from the vector index and the graph in
 * parallel, merge, generate and validate.
 *
 * <p>Every stage appends exactly one reasoning step. Retrieval failures degrade to empty results.
 * Only generation outages and the deadline abort an invocation. On timeout the worker is
 * interrupted, the outstanding retrieval futures are cancelled and the worker stops before its
 * next stage, so no further model call is issued for an abandoned question.
 */
@Service
@Slf4j
public class HybridRagPipeline {

  private final QueryClassifier queryClassifier;
  private final VectorRetriever vectorRetriever;
  private final QueryEntityExtractor entityExtractor;
  private final GraphTraverser graphTraverser;
  private final ContextMerger contextMerger;
  private final AnswerGenerator answerGenerator;
  private final HallucinationGuard hallucinationGuard;
  private final PipelineSettings settings;
  private final AsyncTaskExecutor pipelineExecutor;
  private final Executor retrievalExecutor;
  private final MeterRegistry meterRegistry;

  public HybridRagPipeline(
      QueryClassifier queryClassifier,
      VectorRetriever vectorRetriever,
      QueryEntityExtractor entityExtractor,
      GraphTraverser graphTraverser,
      ContextMerger contextMerger,
      AnswerGenerator answerGenerator,
      HallucinationGuard hallucinationGuard,
      PipelineSettings settings,
      @Qualifier("pipelineExecutor") AsyncTaskExecutor pipelineExecutor,
      @Qualifier("retrievalExecutor") Executor retrievalExecutor,
      MeterRegistry meterRegistry) {
    this.queryClassifier = queryClassifier;
    this.vectorRetriever = vectorRetriever;
    this.entityExtractor = entityExtractor;
    this.graphTraverser = graphTraverser;
    this.contextMerger = contextMerger;
    this.answerGenerator = answerGenerator;
    this.hallucinationGuard = hallucinationGuard;
    this.settings = settings;
    this.pipelineExecutor = pipelineExecutor;
    this.retrievalExecutor = retrievalExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Answers the question within the configured deadline.
   *
   * @throws InvalidQuestionException for a blank question or an out-of-range top-k
   * @throws com.flamingo.ai.hybridrag.exception.LlmServiceException when generation is unavailable
   * @throws PipelineTimeoutException when the deadline elapses or the caller is interrupted
   */
  @Timed(value = "pipeline.answer", description = "Time to answer one question")
  public Answer answer(QueryCommand command) {
    if (command == null || command.question() == null || command.question().isBlank()) {
      throw new InvalidQuestionException("Question must not be empty");
    }
    String question = command.question().strip();
    int topK = resolveTopK(command.topK());

    ReasoningLog reasoning = new ReasoningLog();
    Future<Answer> future =
        pipelineExecutor.submit(() -> run(question, command.useHybrid(), topK, reasoning));
    try {
      return future.get(settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      reasoning.cancel();
      future.cancel(true);
      meterRegistry.counter("pipeline.timeout", "stage", reasoning.currentStage().name())
          .increment();
      log.warn(
          "Pipeline exceeded {} ms during {}, cancelled",
          settings.timeout().toMillis(),
          reasoning.currentStage());
      throw new PipelineTimeoutException(reasoning.currentStage(), settings.timeout());
    } catch (InterruptedException e) {
      reasoning.cancel();
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new PipelineTimeoutException(reasoning.currentStage(), settings.timeout());
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("Pipeline failed: " + cause.getMessage(), cause);
    }
  }

  private int resolveTopK(Integer requested) {
    if (requested == null) {
      return settings.defaultTopK();
    }
    if (requested < 1 || requested > settings.maxTopK()) {
      throw new InvalidQuestionException(
          "topK must be between 1 and " + settings.maxTopK() + ", got " + requested);
    }
    return requested;
  }

  private Answer run(String question, boolean useHybrid, int topK, ReasoningLog reasoning) {
    reasoning.enter(PipelineStage.CLASSIFYING);
    QueryClassification classification = queryClassifier.classify(question);
    QueryType type = classification.queryType();
    reasoning.record(
        "Query classified as " + type.getLabel() + " (" + classification.rationale() + ")");

    reasoning.enter(PipelineStage.RETRIEVING);
    boolean useGraph = useHybrid && type.usesGraph();
    RetrievalOutcome retrieval = retrieve(question, topK, useGraph);
    reasoning.record(describeRetrieval(retrieval, useHybrid, type));

    reasoning.enter(PipelineStage.MERGING);
    MergedContext context = contextMerger.merge(type, retrieval.vectorHits(), retrieval.graph());
    reasoning.record(
        context.isEmpty()
            ? "No context available"
            : String.format(
                Locale.ROOT,
                "Merged %d blocks (%d chars) in %s order",
                context.size(),
                context.totalLength(),
                type.getLabel()));

    reasoning.enter(PipelineStage.GENERATING);
    String generated = answerGenerator.generate(question, context);
    reasoning.record(
        context.isEmpty()
            ? "Skipped generation, no context to ground an answer"
            : "Generated answer of " + generated.length() + " chars");

    reasoning.enter(PipelineStage.VALIDATING);
    ConfidenceReport report = hallucinationGuard.score(generated, context, retrieval.vectorHits());
    String text = report.accepted() ? generated : RefusalPatterns.INSUFFICIENT_INFORMATION;
    String verdictStep =
        String.format(
            Locale.ROOT,
            "Verdict %s, confidence %.3f: %s",
            report.verdict(),
            report.score(),
            report.reason());
    if (!report.accepted() && !generated.equals(text)) {
      verdictStep += ". Withheld answer: " + generated;
    }
    reasoning.record(verdictStep);
    meterRegistry.counter("pipeline.verdict", "verdict", report.verdict().name()).increment();

    reasoning.enter(PipelineStage.DONE);
    List<ScoredChunk> sources = includedSources(retrieval.vectorHits(), context);
    reasoning.record("Returned answer with " + sources.size() + " sources");

    return new Answer(text, report, type, sources, retrieval.graph(), reasoning.steps());
  }

  private RetrievalOutcome retrieve(String question, int topK, boolean useGraph) {
    CompletableFuture<List<ScoredChunk>> vectorFuture =
        CompletableFuture.supplyAsync(
            () -> vectorRetriever.search(question, topK), retrievalExecutor);
    CompletableFuture<GraphRetrievalResult> graphFuture =
        useGraph
            ? CompletableFuture.supplyAsync(() -> retrieveGraph(question), retrievalExecutor)
            : CompletableFuture.completedFuture(GraphRetrievalResult.EMPTY);

    List<String> notes = new ArrayList<>();
    try {
      List<ScoredChunk> vectorHits = await(vectorFuture, "Vector retrieval", List.of(), notes);
      GraphRetrievalResult graph =
          await(graphFuture, "Graph retrieval", GraphRetrievalResult.EMPTY, notes);
      return new RetrievalOutcome(vectorHits, graph, notes);
    } catch (InterruptedException e) {
      vectorFuture.cancel(true);
      graphFuture.cancel(true);
      Thread.currentThread().interrupt();
      throw new CancellationException("Retrieval cancelled");
    }
  }

  private GraphRetrievalResult retrieveGraph(String question) {
    List<String> seeds = entityExtractor.extract(question);
    if (seeds.isEmpty()) {
      log.debug("No entity candidates in question, graph retrieval skipped");
      return GraphRetrievalResult.EMPTY;
    }
    return graphTraverser.traverse(seeds, settings.graphMaxDepth());
  }

  private <T> T await(CompletableFuture<T> future, String leg, T fallback, List<String> notes)
      throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.warn("{} failed, continuing without it: {}", leg, cause.getMessage());
      meterRegistry.counter("pipeline.retrieval.failure", "leg", leg).increment();
      notes.add(leg + " failed (" + cause.getClass().getSimpleName() + ")");
      return fallback;
    }
  }

  private static String describeRetrieval(
      RetrievalOutcome retrieval, boolean useHybrid, QueryType type) {
    StringBuilder step = new StringBuilder();
    step.append(retrieval.vectorHits().size()).append(" vector hits");
    if (!useHybrid) {
      step.append(", graph disabled for this request");
    } else if (!type.usesGraph()) {
      step.append(", graph skipped for ").append(type.getLabel()).append(" questions");
    } else {
      step.append(", graph reached ")
          .append(retrieval.graph().entities().size())
          .append(" entities over ")
          .append(retrieval.graph().relations().size())
          .append(" relations");
    }
    for (String note : retrieval.notes()) {
      step.append("; ").append(note);
    }
    return step.toString();
  }

  private static List<ScoredChunk> includedSources(
      List<ScoredChunk> vectorHits, MergedContext context) {
    Set<String> included = context.chunkIds();
    return vectorHits.stream().filter(hit -> included.contains(hit.chunkId())).toList();
  }

  private record RetrievalOutcome(
      List<ScoredChunk> vectorHits, GraphRetrievalResult graph, List<String> notes) {}
}
