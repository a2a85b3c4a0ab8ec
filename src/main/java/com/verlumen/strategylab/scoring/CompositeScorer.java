package com.verlumen.strategylab.scoring;

import com.verlumen.strategylab.evaluation.AggregatedMetrics;

/** Maps aggregated metrics to a single weighted fitness value. */
public interface CompositeScorer {
  /** Weighted sum of normalized criteria, in [0, 1]. */
  double score(AggregatedMetrics metrics, FitnessProfile profile);

  /** One criterion normalized into [0, 1]; costs are inverted so that 1 is always best. */
  double normalize(Criterion criterion, AggregatedMetrics metrics, FitnessProfile profile);

  /**
   * Applies the profile's hard thresholds. A high score never overrides a failed threshold.
   */
  DeploymentVerdict isDeploymentReady(
      double score, AggregatedMetrics metrics, FitnessProfile profile);
}
