package com.flamingo.ai.hybridrag.service.rag.pipeline;

import com.flamingo.ai.hybridrag.domain.enums.PipelineStage;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/** Ordered record of stage transitions and absorbed conditions for one invocation. */
final class ReasoningLog {

  private final List<String> steps = new ArrayList<>();
  private volatile PipelineStage currentStage = PipelineStage.CLASSIFYING;
  private volatile boolean cancelled;

  /**
   * Moves to {@code stage}. Stages only move forward.
   *
   * @throws CancellationException once the caller has given up on this invocation
   */
  void enter(PipelineStage stage) {
    if (cancelled) {
      throw new CancellationException("Pipeline cancelled during " + currentStage);
    }
    if (stage.ordinal() < currentStage.ordinal()) {
      throw new IllegalStateException("Cannot move from " + currentStage + " back to " + stage);
    }
    currentStage = stage;
  }

  /** Records the outcome of the current stage. */
  void record(String detail) {
    steps.add(currentStage.getDisplayName() + ": " + detail);
  }

  /** Marks the invocation as abandoned; the worker stops at its next stage transition. */
  void cancel() {
    cancelled = true;
  }

  boolean isCancelled() {
    return cancelled;
  }

  PipelineStage currentStage() {
    return currentStage;
  }

  List<String> steps() {
    return List.copyOf(steps);
  }
}
