package com.verlumen.strategylab.evaluation;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.verlumen.strategylab.genome.CandidateKey;
import java.util.Map;

/**
 * Results of evaluating a whole population. A candidate is in exactly one of {@link #results()} and
 * {@link #failures()}; a candidate in {@code failures} is unscored for this generation.
 */
@AutoValue
public abstract class BatchEvaluation {
  public static BatchEvaluation create(
      Map<CandidateKey, AggregatedMetrics> results,
      Map<CandidateKey, String> failures,
      boolean timedOut) {
    return new AutoValue_BatchEvaluation(
        ImmutableMap.copyOf(results), ImmutableMap.copyOf(failures), timedOut);
  }

  public abstract ImmutableMap<CandidateKey, AggregatedMetrics> results();

  /** Reason each unscored candidate produced nothing. */
  public abstract ImmutableMap<CandidateKey, String> failures();

  /** Whether the batch deadline passed and unfinished runs were cancelled. */
  public abstract boolean timedOut();
}
