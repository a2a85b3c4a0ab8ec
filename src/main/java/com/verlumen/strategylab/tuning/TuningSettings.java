package com.verlumen.strategylab.tuning;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class TuningSettings {
  public static TuningSettings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_TuningSettings.Builder()
        .setPopulationSize(24)
        .setGenerations(20)
        .setMutationRate(0.2)
        .setCrossoverRate(0.8)
        .setEliteCount(2)
        .setTournamentSize(3);
  }

  public abstract int populationSize();

  public abstract int generations();

  /** Chance that each gene of an offspring is redrawn from its range. */
  public abstract double mutationRate();

  public abstract double crossoverRate();

  /** Best individuals carried into the next generation unchanged. */
  public abstract int eliteCount();

  public abstract int tournamentSize();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPopulationSize(int value);

    public abstract Builder setGenerations(int value);

    public abstract Builder setMutationRate(double value);

    public abstract Builder setCrossoverRate(double value);

    public abstract Builder setEliteCount(int value);

    public abstract Builder setTournamentSize(int value);

    abstract TuningSettings autoBuild();

    public TuningSettings build() {
      TuningSettings settings = autoBuild();
      checkArgument(settings.populationSize() >= 2, "Population needs at least two individuals");
      checkArgument(settings.generations() > 0, "Generations must be positive");
      checkArgument(
          settings.eliteCount() >= 0 && settings.eliteCount() < settings.populationSize(),
          "Elite count must be below the population size");
      return settings;
    }
  }
}
