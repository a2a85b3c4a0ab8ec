package com.verlumen.strategylab.evaluation;

/** Thrown when a candidate cannot be evaluated at all: unknown version, or every market failed. */
public final class EvaluationException extends Exception {
  public EvaluationException(String message) {
    super(message);
  }

  public EvaluationException(String message, Throwable cause) {
    super(message, cause);
  }
}
