package com.verlumen.strategylab.registry;

import com.verlumen.strategylab.evaluation.MetricsRecord;
import com.verlumen.strategylab.marketdata.Timeframe;
import java.time.Instant;

/** Gson shape of a metrics record in the {@code metrics_blob} column. */
final class MetricsBlob {
  String market;
  String timeframe;
  long windowStartMillis;
  long windowEndMillis;
  double pnl;
  double sharpeRatio;
  double maxDrawdown;
  double winRate;
  double profitFactor;
  int numTrades;
  double slippage;
  double executionDelayMs;
  double marketImpact;
  double volatilityAdjustedReturn;
  double downsideDeviation;
  boolean estimated;

  static MetricsBlob of(MetricsRecord record) {
    MetricsBlob blob = new MetricsBlob();
    blob.market = record.market();
    blob.timeframe = record.timeframe().label();
    blob.windowStartMillis = record.windowStart().toEpochMilli();
    blob.windowEndMillis = record.windowEnd().toEpochMilli();
    blob.pnl = record.pnl();
    blob.sharpeRatio = record.sharpeRatio();
    blob.maxDrawdown = record.maxDrawdown();
    blob.winRate = record.winRate();
    blob.profitFactor = record.profitFactor();
    blob.numTrades = record.numTrades();
    blob.slippage = record.slippage();
    blob.executionDelayMs = record.executionDelayMs();
    blob.marketImpact = record.marketImpact();
    blob.volatilityAdjustedReturn = record.volatilityAdjustedReturn();
    blob.downsideDeviation = record.downsideDeviation();
    blob.estimated = record.estimated();
    return blob;
  }

  MetricsRecord toRecord() {
    return MetricsRecord.builder()
        .setMarket(market)
        .setTimeframe(Timeframe.fromLabel(timeframe))
        .setWindowStart(Instant.ofEpochMilli(windowStartMillis))
        .setWindowEnd(Instant.ofEpochMilli(windowEndMillis))
        .setPnl(pnl)
        .setSharpeRatio(sharpeRatio)
        .setMaxDrawdown(maxDrawdown)
        .setWinRate(winRate)
        .setProfitFactor(profitFactor)
        .setNumTrades(numTrades)
        .setSlippage(slippage)
        .setExecutionDelayMs(executionDelayMs)
        .setMarketImpact(marketImpact)
        .setVolatilityAdjustedReturn(volatilityAdjustedReturn)
        .setDownsideDeviation(downsideDeviation)
        .setEstimated(estimated)
        .build();
  }
}
