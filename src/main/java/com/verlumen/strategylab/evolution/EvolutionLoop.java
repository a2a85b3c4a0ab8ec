package com.verlumen.strategylab.evolution;

import com.verlumen.strategylab.genome.CandidateKey;
import com.verlumen.strategylab.genome.Genome;
import java.util.List;

/** Generational search: evaluate, score, rank, select, reproduce. */
public interface EvolutionLoop {
  /**
   * Seeds a population from {@code base} and evolves it until fitness stops improving for {@code
   * patience} generations or {@code maxGenerations} is reached.
   */
  EvolutionResult run(Genome base, EvolutionConfig config);

  /**
   * Runs one generation over {@code population}. The returned next population always has the same
   * size as the input.
   */
  GenerationOutcome runGeneration(
      int generation, List<CandidateKey> population, EvolutionConfig config);
}
