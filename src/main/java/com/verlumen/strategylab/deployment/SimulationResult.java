package com.verlumen.strategylab.deployment;

import com.google.auto.value.AutoValue;

/** Distribution of outcomes over bootstrap-resampled return paths. */
@AutoValue
public abstract class SimulationResult {
  public abstract int simulations();

  public abstract double meanReturn();

  public abstract double medianReturn();

  public abstract double stdReturn();

  public abstract double minReturn();

  public abstract double maxReturn();

  public abstract double returnCiLower();

  public abstract double returnCiUpper();

  public abstract double sharpeCiLower();

  public abstract double sharpeCiUpper();

  public abstract double probabilityOfProfit();

  /** Share of paths whose drawdown exceeded the ruin threshold. */
  public abstract double probabilityOfRuin();

  /** 5th percentile of path returns. */
  public abstract double valueAtRisk95();

  /** Mean of the path returns at or below the value at risk. */
  public abstract double conditionalValueAtRisk95();

  /** 0-100, higher is more robust. */
  public abstract double robustnessScore();

  public double returnCiWidth() {
    return returnCiUpper() - returnCiLower();
  }

  static Builder builder() {
    return new AutoValue_SimulationResult.Builder();
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setSimulations(int value);

    abstract Builder setMeanReturn(double value);

    abstract Builder setMedianReturn(double value);

    abstract Builder setStdReturn(double value);

    abstract Builder setMinReturn(double value);

    abstract Builder setMaxReturn(double value);

    abstract Builder setReturnCiLower(double value);

    abstract Builder setReturnCiUpper(double value);

    abstract Builder setSharpeCiLower(double value);

    abstract Builder setSharpeCiUpper(double value);

    abstract Builder setProbabilityOfProfit(double value);

    abstract Builder setProbabilityOfRuin(double value);

    abstract Builder setValueAtRisk95(double value);

    abstract Builder setConditionalValueAtRisk95(double value);

    abstract Builder setRobustnessScore(double value);

    abstract SimulationResult build();
  }
}
