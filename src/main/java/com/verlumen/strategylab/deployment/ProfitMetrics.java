package com.verlumen.strategylab.deployment;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/** Profit quality of a return series, with its statistical validation. */
@AutoValue
public abstract class ProfitMetrics {
  public abstract int periods();

  public abstract double totalReturn();

  public abstract double annualizedReturn();

  public abstract double cagr();

  public abstract double sharpeRatio();

  /** Infinite when no period lost money. */
  public abstract double sortinoRatio();

  /** Infinite when the equity curve never fell. */
  public abstract double calmarRatio();

  public abstract double omegaRatio();

  public abstract double testStatistic();

  /** Two-sided p-value of a one-sample t-test of the mean return against zero. */
  public abstract double testPValue();

  public abstract boolean statisticallySignificant();

  /** Annualized mean return interval. */
  public abstract double returnCiLower();

  public abstract double returnCiUpper();

  public abstract double sharpeCiLower();

  public abstract double sharpeCiUpper();

  public abstract Optional<TradeAnalysis> tradeAnalysis();

  public abstract double qualityScore();

  public abstract ProfitQuality quality();

  static Builder builder() {
    return new AutoValue_ProfitMetrics.Builder();
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setPeriods(int value);

    abstract Builder setTotalReturn(double value);

    abstract Builder setAnnualizedReturn(double value);

    abstract Builder setCagr(double value);

    abstract Builder setSharpeRatio(double value);

    abstract Builder setSortinoRatio(double value);

    abstract Builder setCalmarRatio(double value);

    abstract Builder setOmegaRatio(double value);

    abstract Builder setTestStatistic(double value);

    abstract Builder setTestPValue(double value);

    abstract Builder setStatisticallySignificant(boolean value);

    abstract Builder setReturnCiLower(double value);

    abstract Builder setReturnCiUpper(double value);

    abstract Builder setSharpeCiLower(double value);

    abstract Builder setSharpeCiUpper(double value);

    abstract Builder setTradeAnalysis(Optional<TradeAnalysis> value);

    abstract Builder setQualityScore(double value);

    abstract Builder setQuality(ProfitQuality value);

    abstract ProfitMetrics build();
  }
}
