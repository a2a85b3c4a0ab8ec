package com.verlumen.strategylab.scoring;

import com.google.auto.value.AutoValue;
import java.util.Locale;

/** Hard limits a candidate must meet regardless of its weighted score. */
@AutoValue
public abstract class DeploymentThresholds {
  public static final DeploymentThresholds DEMO =
      builder()
          .setName("DEMO")
          .setMinFitness(0.2)
          .setMinSharpeRatio(0.3)
          .setMinWinRate(0.40)
          .setMaxDrawdown(0.35)
          .setMinTradesPerMarket(5)
          .setMinMarketsTested(2)
          .setMaxSlippage(0.02)
          .setMaxExecutionDelayMs(1000)
          .setMaxMarketImpact(0.05)
          .setMinTotalTrades(20)
          .build();

  public static final DeploymentThresholds PRODUCTION =
      builder()
          .setName("PRODUCTION")
          .setMinFitness(0.4)
          .setMinSharpeRatio(0.8)
          .setMinWinRate(0.50)
          .setMaxDrawdown(0.20)
          .setMinTradesPerMarket(15)
          .setMinMarketsTested(5)
          .setMaxSlippage(0.008)
          .setMaxExecutionDelayMs(300)
          .setMaxMarketImpact(0.05)
          .setMinTotalTrades(50)
          .build();

  public static DeploymentThresholds fromName(String name) {
    switch (name.toUpperCase(Locale.ROOT)) {
      case "DEMO":
        return DEMO;
      case "PRODUCTION":
        return PRODUCTION;
      default:
        throw new IllegalArgumentException("Unknown threshold tier: " + name);
    }
  }

  public abstract String name();

  public abstract double minFitness();

  public abstract double minSharpeRatio();

  public abstract double minWinRate();

  public abstract double maxDrawdown();

  public abstract double minTradesPerMarket();

  public abstract int minMarketsTested();

  public abstract double maxSlippage();

  public abstract double maxExecutionDelayMs();

  public abstract double maxMarketImpact();

  public abstract int minTotalTrades();

  public static Builder builder() {
    return new AutoValue_DeploymentThresholds.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String name);

    public abstract Builder setMinFitness(double minFitness);

    public abstract Builder setMinSharpeRatio(double minSharpeRatio);

    public abstract Builder setMinWinRate(double minWinRate);

    public abstract Builder setMaxDrawdown(double maxDrawdown);

    public abstract Builder setMinTradesPerMarket(double minTradesPerMarket);

    public abstract Builder setMinMarketsTested(int minMarketsTested);

    public abstract Builder setMaxSlippage(double maxSlippage);

    public abstract Builder setMaxExecutionDelayMs(double maxExecutionDelayMs);

    public abstract Builder setMaxMarketImpact(double maxMarketImpact);

    public abstract Builder setMinTotalTrades(int minTotalTrades);

    public abstract DeploymentThresholds build();
  }
}
