package com.verlumen.strategylab.deployment;

/**
 * Turns walk-forward degradation statistics into an overfitting score in [0, 100]. More mean
 * degradation, more variance in degradation and a lower pass rate must never lower the score.
 */
public interface OverfittingPolicy {
  double score(double meanDegradation, double degradationStd, double passRate);
}
