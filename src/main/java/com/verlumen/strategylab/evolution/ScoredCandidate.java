package com.verlumen.strategylab.evolution;

import com.google.auto.value.AutoValue;
import com.verlumen.strategylab.evaluation.AggregatedMetrics;
import com.verlumen.strategylab.genome.CandidateKey;
import com.verlumen.strategylab.scoring.DeploymentVerdict;
import java.util.Comparator;

/** A candidate that produced metrics this generation, with its fitness and readiness verdict. */
@AutoValue
public abstract class ScoredCandidate {
  /** Fitness descending, then genome id ascending. */
  public static final Comparator<ScoredCandidate> RANKING =
      Comparator.comparingDouble(ScoredCandidate::fitness)
          .reversed()
          .thenComparing(scored -> scored.key().genomeId())
          .thenComparing(scored -> scored.key().versionId());

  static ScoredCandidate create(
      CandidateKey key, AggregatedMetrics metrics, double fitness, DeploymentVerdict verdict) {
    return new AutoValue_ScoredCandidate(key, metrics, fitness, verdict);
  }

  public abstract CandidateKey key();

  public abstract AggregatedMetrics metrics();

  public abstract double fitness();

  public abstract DeploymentVerdict verdict();
}
