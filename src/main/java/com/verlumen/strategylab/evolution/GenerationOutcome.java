package com.verlumen.strategylab.evolution;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.strategylab.genome.CandidateKey;
import java.util.List;

/** What one generation produced: its ranking, its summary and the population that follows. */
@AutoValue
public abstract class GenerationOutcome {
  static GenerationOutcome create(
      List<ScoredCandidate> ranked, GenerationSummary summary, List<CandidateKey> next) {
    return new AutoValue_GenerationOutcome(
        ImmutableList.copyOf(ranked), summary, ImmutableList.copyOf(next));
  }

  /** Scored candidates, best first. */
  public abstract ImmutableList<ScoredCandidate> ranked();

  public abstract GenerationSummary summary();

  public abstract ImmutableList<CandidateKey> nextPopulation();
}
