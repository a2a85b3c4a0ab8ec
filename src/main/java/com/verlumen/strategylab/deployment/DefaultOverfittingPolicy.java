package com.verlumen.strategylab.deployment;

import com.google.inject.Inject;

/** Degradation weighs 60 points, its spread 20 and the failure rate 20. */
final class DefaultOverfittingPolicy implements OverfittingPolicy {
  @Inject
  DefaultOverfittingPolicy() {}

  @Override
  public double score(double meanDegradation, double degradationStd, double passRate) {
    double degradation = Math.max(0.0, Math.min(1.0, meanDegradation)) * 60;
    double inconsistency = Math.min(20, degradationStd * 40);
    double failures = (1 - passRate) * 20;
    return Math.max(0, Math.min(100, degradation + inconsistency + failures));
  }
}
