package com.verlumen.strategylab.evolution;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.strategylab.genome.CandidateKey;
import java.util.Map;
import java.util.Optional;

/** Audit record of one generation. Fitness figures cover scored candidates only. */
@AutoValue
public abstract class GenerationSummary {
  public abstract int generation();

  public abstract double bestFitness();

  public abstract double avgFitness();

  public abstract int populationSize();

  public abstract int evaluated();

  public abstract int failed();

  public abstract int deploymentReady();

  /** Distinct markets tested across the scored candidates. */
  public abstract int marketDiversity();

  public abstract Optional<CandidateKey> bestCandidate();

  /** Hard-threshold failures of each scored candidate that was not deployment ready. */
  public abstract ImmutableMap<CandidateKey, ImmutableList<String>> deniedReasons();

  /** Why each unscored candidate produced no metrics. */
  public abstract ImmutableMap<CandidateKey, String> failureReasons();

  static Builder builder() {
    return new AutoValue_GenerationSummary.Builder();
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setGeneration(int generation);

    abstract Builder setBestFitness(double bestFitness);

    abstract Builder setAvgFitness(double avgFitness);

    abstract Builder setPopulationSize(int populationSize);

    abstract Builder setEvaluated(int evaluated);

    abstract Builder setFailed(int failed);

    abstract Builder setDeploymentReady(int deploymentReady);

    abstract Builder setMarketDiversity(int marketDiversity);

    abstract Builder setBestCandidate(Optional<CandidateKey> bestCandidate);

    abstract Builder setDeniedReasons(Map<CandidateKey, ImmutableList<String>> deniedReasons);

    abstract Builder setFailureReasons(Map<CandidateKey, String> failureReasons);

    abstract GenerationSummary build();
  }
}
