package com.verlumen.strategylab.evaluation;

/** The external executor could not be started, failed, or ran past its timeout. */
public final class ExecutorException extends Exception {
  public ExecutorException(String message) {
    super(message);
  }

  public ExecutorException(String message, Throwable cause) {
    super(message, cause);
  }
}
