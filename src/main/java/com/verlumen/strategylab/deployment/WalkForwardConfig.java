package com.verlumen.strategylab.deployment;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class WalkForwardConfig {
  public static WalkForwardConfig defaults() {
    return create(5, false);
  }

  public static WalkForwardConfig create(int periods, boolean anchored) {
    checkArgument(periods >= 1, "At least one walk-forward period is required");
    return new AutoValue_WalkForwardConfig(periods, anchored, 0.7, 0.05, 0.8, 0.5, 50, 200);
  }

  public abstract int periods();

  /** Anchored windows always start in-sample at the first bar; rolling windows move. */
  public abstract boolean anchored();

  public abstract double inSampleRatio();

  public abstract double minOutOfSampleReturn();

  public abstract double minOutOfSampleSharpe();

  /** Largest relative in-sample to out-of-sample return loss a period may show and still pass. */
  public abstract double maxPeriodDegradation();

  /** Periods with fewer out-of-sample bars are skipped. */
  public abstract int minOutOfSampleBars();

  public abstract int minBars();
}
