package com.verlumen.strategylab.deployment;

import com.google.auto.value.AutoValue;

/** Thresholds every stage of the deployment gate is checked against. */
@AutoValue
public abstract class ValidationChecklist {
  public static ValidationChecklist defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_ValidationChecklist.Builder()
        .setMinMarketsPassed(4)
        .setMinPassRate(0.6)
        .setMinMeanSharpe(1.0)
        .setMaxMeanDrawdown(0.30)
        .setMinTotalReturn(0.10)
        .setMinSharpeRatio(1.0)
        .setMinQualityScore(60.0)
        .setRequireSignificance(true)
        .setMinWalkForwardPassRate(0.6)
        .setMaxOverfittingScore(60.0)
        .setMaxDegradation(0.40)
        .setMinProbabilityOfProfit(0.65)
        .setMaxProbabilityOfRuin(0.05)
        .setMinRobustnessScore(60.0);
  }

  // Multi-market
  public abstract int minMarketsPassed();

  public abstract double minPassRate();

  public abstract double minMeanSharpe();

  public abstract double maxMeanDrawdown();

  // Profit quality
  public abstract double minTotalReturn();

  public abstract double minSharpeRatio();

  public abstract double minQualityScore();

  /** When set, an insignificant t-test is a critical failure. */
  public abstract boolean requireSignificance();

  // Walk-forward
  public abstract double minWalkForwardPassRate();

  public abstract double maxOverfittingScore();

  public abstract double maxDegradation();

  // Robustness simulation
  public abstract double minProbabilityOfProfit();

  public abstract double maxProbabilityOfRuin();

  public abstract double minRobustnessScore();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMinMarketsPassed(int value);

    public abstract Builder setMinPassRate(double value);

    public abstract Builder setMinMeanSharpe(double value);

    public abstract Builder setMaxMeanDrawdown(double value);

    public abstract Builder setMinTotalReturn(double value);

    public abstract Builder setMinSharpeRatio(double value);

    public abstract Builder setMinQualityScore(double value);

    public abstract Builder setRequireSignificance(boolean value);

    public abstract Builder setMinWalkForwardPassRate(double value);

    public abstract Builder setMaxOverfittingScore(double value);

    public abstract Builder setMaxDegradation(double value);

    public abstract Builder setMinProbabilityOfProfit(double value);

    public abstract Builder setMaxProbabilityOfRuin(double value);

    public abstract Builder setMinRobustnessScore(double value);

    public abstract ValidationChecklist build();
  }
}
