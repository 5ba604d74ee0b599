package com.flamingo.ai.hybridrag.domain.enums;

/** Stages of one pipeline invocation, in execution order. */
public enum PipelineStage {
  CLASSIFYING("Classifying"),
  RETRIEVING("Retrieving"),
  MERGING("Merging"),
  GENERATING("Generating"),
  VALIDATING("Validating"),
  DONE("Done");

  private final String displayName;

  PipelineStage(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }
}
