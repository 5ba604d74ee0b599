package com.flamingo.ai.hybridrag.exception;

/** Thrown when a question is missing or blank. No pipeline stage runs. */
public class InvalidQuestionException extends RuntimeException {

  public InvalidQuestionException(String message) {
    super(message);
  }
}
