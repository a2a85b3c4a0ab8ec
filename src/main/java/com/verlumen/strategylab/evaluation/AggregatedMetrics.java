package com.verlumen.strategylab.evaluation;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.verlumen.strategylab.marketdata.Timeframe;

/**
 * Combined result of one candidate version across every market that evaluated successfully.
 * Built by {@link MetricsAggregator}.
 */
@AutoValue
public abstract class AggregatedMetrics {
  public abstract double totalPnl();

  public abstract double sharpeRatio();

  public abstract double maxDrawdown();

  public abstract double winRate();

  public abstract double profitFactor();

  public abstract int numTrades();

  public abstract double slippage();

  public abstract double executionDelayMs();

  public abstract double marketImpact();

  public abstract double volatilityAdjustedReturn();

  public abstract double downsideDeviation();

  public abstract ImmutableSortedSet<String> marketsTested();

  public abstract ImmutableSortedSet<Timeframe> timeframesTested();

  public abstract int recordCount();

  public abstract ImmutableList<MarketFailure> failures();

  public double avgTradePnl() {
    return numTrades() == 0 ? 0.0 : totalPnl() / numTrades();
  }

  /** Trades per market tested. */
  public double avgTradesPerMarket() {
    return (double) numTrades() / Math.max(marketsTested().size(), 1);
  }

  public AggregatedMetrics withFailures(Iterable<MarketFailure> failures) {
    return toBuilder().setFailures(failures).build();
  }

  abstract Builder toBuilder();

  static Builder builder() {
    return new AutoValue_AggregatedMetrics.Builder().setFailures(ImmutableList.of());
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setTotalPnl(double totalPnl);

    abstract Builder setSharpeRatio(double sharpeRatio);

    abstract Builder setMaxDrawdown(double maxDrawdown);

    abstract Builder setWinRate(double winRate);

    abstract Builder setProfitFactor(double profitFactor);

    abstract Builder setNumTrades(int numTrades);

    abstract Builder setSlippage(double slippage);

    abstract Builder setExecutionDelayMs(double executionDelayMs);

    abstract Builder setMarketImpact(double marketImpact);

    abstract Builder setVolatilityAdjustedReturn(double volatilityAdjustedReturn);

    abstract Builder setDownsideDeviation(double downsideDeviation);

    abstract Builder setMarketsTested(Iterable<String> marketsTested);

    abstract Builder setTimeframesTested(Iterable<Timeframe> timeframesTested);

    abstract Builder setRecordCount(int recordCount);

    abstract Builder setFailures(Iterable<MarketFailure> failures);

    abstract AggregatedMetrics build();
  }
}
