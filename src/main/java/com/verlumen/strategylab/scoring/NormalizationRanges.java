package com.verlumen.strategylab.scoring;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Values at which each open-ended metric earns a full score (or, for costs, a zero score). */
@AutoValue
public abstract class NormalizationRanges {
  public static final NormalizationRanges DEFAULT = create(1000.0, 3.0, 50.0, 0.05, 1000.0, 5);

  public static NormalizationRanges create(
      double pnlMax,
      double sharpeMax,
      double tradeFrequencyMax,
      double slippageTolerance,
      double executionDelayMaxMs,
      int diversityTarget) {
    checkArgument(pnlMax > 0, "pnlMax must be positive");
    checkArgument(sharpeMax > 0, "sharpeMax must be positive");
    checkArgument(tradeFrequencyMax > 0, "tradeFrequencyMax must be positive");
    checkArgument(slippageTolerance > 0, "slippageTolerance must be positive");
    checkArgument(executionDelayMaxMs > 0, "executionDelayMaxMs must be positive");
    checkArgument(diversityTarget > 0, "diversityTarget must be positive");
    return new AutoValue_NormalizationRanges(
        pnlMax, sharpeMax, tradeFrequencyMax, slippageTolerance, executionDelayMaxMs, diversityTarget);
  }

  /** PnL in percent. */
  public abstract double pnlMax();

  public abstract double sharpeMax();

  /** Average trades per market. */
  public abstract double tradeFrequencyMax();

  public abstract double slippageTolerance();

  public abstract double executionDelayMaxMs();

  /** Distinct markets for a full diversity score. */
  public abstract int diversityTarget();
}
