package com.verlumen.strategylab.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.time.Duration;

@AutoValue
public abstract class EvolutionConfig {
  public static Builder builder() {
    return new AutoValue_EvolutionConfig.Builder()
        .setPopulationSize(8)
        .setMaxGenerations(15)
        .setEliteSize(2)
        .setMutationRate(0.3)
        .setVariantsPerIndividual(3)
        .setPatience(5)
        .setGenerationTimeout(Duration.ofMinutes(30));
  }

  /** Number of candidates in every generation, including the seed population. */
  public abstract int populationSize();

  public abstract int maxGenerations();

  /** Top-ranked candidates carried into the next generation unchanged. */
  public abstract int eliteSize();

  /** Chance that a selected parent is mutated rather than cloned. */
  public abstract double mutationRate();

  /** Size of each sibling group: one individual plus {@code variantsPerIndividual - 1} variants. */
  public abstract int variantsPerIndividual();

  /** Consecutive generations without a strictly better best fitness before stopping. */
  public abstract int patience();

  public abstract Duration generationTimeout();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPopulationSize(int populationSize);

    public abstract Builder setMaxGenerations(int maxGenerations);

    public abstract Builder setEliteSize(int eliteSize);

    public abstract Builder setMutationRate(double mutationRate);

    public abstract Builder setVariantsPerIndividual(int variantsPerIndividual);

    public abstract Builder setPatience(int patience);

    public abstract Builder setGenerationTimeout(Duration generationTimeout);

    abstract EvolutionConfig autoBuild();

    public EvolutionConfig build() {
      EvolutionConfig config = autoBuild();
      checkArgument(config.populationSize() >= 2, "Population needs at least two candidates");
      checkArgument(config.maxGenerations() >= 1, "At least one generation is required");
      checkArgument(
          config.eliteSize() >= 0 && config.eliteSize() < config.populationSize(),
          "Elite size must be in [0, populationSize)");
      checkArgument(
          config.mutationRate() >= 0 && config.mutationRate() <= 1,
          "Mutation rate must be in [0, 1]");
      checkArgument(config.variantsPerIndividual() >= 1, "Variants per individual must be >= 1");
      checkArgument(config.patience() >= 1, "Patience must be >= 1");
      checkArgument(!config.generationTimeout().isNegative(), "Timeout cannot be negative");
      return config;
    }
  }
}
