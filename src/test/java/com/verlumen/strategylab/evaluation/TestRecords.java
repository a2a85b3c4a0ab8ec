package com.verlumen.strategylab.evaluation;

import com.verlumen.strategylab.marketdata.Timeframe;
import java.time.Instant;

/** Builders for metrics records used across test packages. */
public final class TestRecords {
  public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
  public static final Instant END = Instant.parse("2024-01-31T00:00:00Z");

  /** A record with neutral execution figures that clears the DEMO thresholds on its own. */
  public static MetricsRecord.Builder record(String market) {
    return MetricsRecord.builder()
        .setMarket(market)
        .setTimeframe(Timeframe.M5)
        .setWindowStart(START)
        .setWindowEnd(END)
        .setPnl(10.0)
        .setSharpeRatio(2.0)
        .setMaxDrawdown(0.1)
        .setWinRate(0.6)
        .setProfitFactor(1.5)
        .setNumTrades(10)
        .setSlippage(0.001)
        .setExecutionDelayMs(50)
        .setMarketImpact(0.001)
        .setVolatilityAdjustedReturn(1.0)
        .setDownsideDeviation(0.2);
  }

  public static MetricsRecord record(String market, double pnl) {
    return record(market).setPnl(pnl).build();
  }

  private TestRecords() {}
}
