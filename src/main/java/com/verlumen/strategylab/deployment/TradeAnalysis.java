package com.verlumen.strategylab.deployment;

import com.google.auto.value.AutoValue;

/** Trade-level profitability. */
@AutoValue
public abstract class TradeAnalysis {
  public abstract int totalTrades();

  public abstract int winningTrades();

  public abstract int losingTrades();

  public abstract double winRate();

  public abstract double lossRate();

  public abstract double grossProfit();

  public abstract double grossLoss();

  public abstract double netProfit();

  /** Gross profit over gross loss; infinite without losses. */
  public abstract double profitFactor();

  public abstract double avgWin();

  /** Mean size of a losing trade, as a positive number. */
  public abstract double avgLoss();

  public abstract double largestWin();

  public abstract double largestLoss();

  public abstract int maxConsecutiveWins();

  public abstract int maxConsecutiveLosses();

  public abstract double riskRewardRatio();

  /** Kelly fraction, floored at 0 and capped at 25%. */
  public abstract double kellyFraction();

  /** Expected profit per trade. */
  public abstract double expectancy();

  static Builder builder() {
    return new AutoValue_TradeAnalysis.Builder();
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setTotalTrades(int value);

    abstract Builder setWinningTrades(int value);

    abstract Builder setLosingTrades(int value);

    abstract Builder setWinRate(double value);

    abstract Builder setLossRate(double value);

    abstract Builder setGrossProfit(double value);

    abstract Builder setGrossLoss(double value);

    abstract Builder setNetProfit(double value);

    abstract Builder setProfitFactor(double value);

    abstract Builder setAvgWin(double value);

    abstract Builder setAvgLoss(double value);

    abstract Builder setLargestWin(double value);

    abstract Builder setLargestLoss(double value);

    abstract Builder setMaxConsecutiveWins(int value);

    abstract Builder setMaxConsecutiveLosses(int value);

    abstract Builder setRiskRewardRatio(double value);

    abstract Builder setKellyFraction(double value);

    abstract Builder setExpectancy(double value);

    abstract TradeAnalysis build();
  }
}
