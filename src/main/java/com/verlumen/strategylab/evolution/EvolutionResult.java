package com.verlumen.strategylab.evolution;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.strategylab.genome.CandidateKey;
import java.util.List;
import java.util.Optional;

@AutoValue
public abstract class EvolutionResult {
  static EvolutionResult create(
      List<CandidateKey> finalPopulation,
      List<GenerationSummary> history,
      StopReason stopReason,
      Optional<ScoredCandidate> best) {
    return new AutoValue_EvolutionResult(
        ImmutableList.copyOf(finalPopulation), ImmutableList.copyOf(history), stopReason, best);
  }

  public abstract ImmutableList<CandidateKey> finalPopulation();

  public abstract ImmutableList<GenerationSummary> history();

  public abstract StopReason stopReason();

  /** Best candidate seen in any generation. */
  public abstract Optional<ScoredCandidate> best();

  public int generationsCompleted() {
    return history().size();
  }

  public double bestFitness() {
    return best().map(ScoredCandidate::fitness).orElse(0.0);
  }
}
