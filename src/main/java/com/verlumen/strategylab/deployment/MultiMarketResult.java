package com.verlumen.strategylab.deployment;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Cross-market consistency of one candidate over the standard validation matrix. */
@AutoValue
public abstract class MultiMarketResult {
  public abstract ImmutableList<MarketVerdict> verdicts();

  public abstract int marketsPassed();

  /** Markets that ran but missed a standard, plus markets that produced nothing. */
  public abstract int marketsFailed();

  public abstract double passRate();

  public abstract double meanSharpe();

  public abstract double medianSharpe();

  public abstract double minSharpe();

  public abstract double maxSharpe();

  public abstract double meanDrawdown();

  public abstract double maxDrawdown();

  public abstract double meanWinRate();

  public abstract double meanProfitFactor();

  public abstract double sharpeCiLower();

  public abstract double sharpeCiUpper();

  /** Lower bound of the 95% Sharpe interval is above 0.5. */
  public abstract boolean performanceConsistent();

  static Builder builder() {
    return new AutoValue_MultiMarketResult.Builder();
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setVerdicts(List<MarketVerdict> verdicts);

    abstract Builder setMarketsPassed(int value);

    abstract Builder setMarketsFailed(int value);

    abstract Builder setPassRate(double value);

    abstract Builder setMeanSharpe(double value);

    abstract Builder setMedianSharpe(double value);

    abstract Builder setMinSharpe(double value);

    abstract Builder setMaxSharpe(double value);

    abstract Builder setMeanDrawdown(double value);

    abstract Builder setMaxDrawdown(double value);

    abstract Builder setMeanWinRate(double value);

    abstract Builder setMeanProfitFactor(double value);

    abstract Builder setSharpeCiLower(double value);

    abstract Builder setSharpeCiUpper(double value);

    abstract Builder setPerformanceConsistent(boolean value);

    abstract MultiMarketResult build();
  }
}
