package com.verlumen.strategylab.evolution;

public enum StopReason {
  /** Best fitness did not strictly improve for {@code patience} generations. */
  CONVERGED,
  MAX_GENERATIONS
}
