package com.verlumen.strategylab.deployment;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class SimulationConfig {
  private static final long DEFAULT_SEED = 42L;

  public static SimulationConfig defaults() {
    return create(1000, 0.95, DEFAULT_SEED);
  }

  public static SimulationConfig create(int simulations, double confidenceLevel, long seed) {
    checkArgument(simulations >= 1, "At least one simulation is required");
    checkArgument(
        confidenceLevel > 0 && confidenceLevel < 1, "Confidence level must be in (0, 1)");
    return new AutoValue_SimulationConfig(simulations, confidenceLevel, 0.5, seed);
  }

  public abstract int simulations();

  public abstract double confidenceLevel();

  /** A resampled path whose drawdown exceeds this counts as ruined. */
  public abstract double ruinDrawdown();

  /** Every simulation starts from this seed, so reports are reproducible. */
  public abstract long seed();
}
