package com.verlumen.strategylab.evaluation;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import com.verlumen.strategylab.marketdata.Candle;
import com.verlumen.strategylab.marketdata.MarketConfig;
import com.verlumen.strategylab.marketdata.Timeframe;
import com.verlumen.strategylab.marketdata.VolatilityRegime;
import java.util.List;

/**
 * Heuristic frictions. Slippage and delay grow with volatility, slippage shrinks on longer
 * timeframes, and impact grows with trade size relative to average bar volume up to a cap.
 */
final class DefaultExecutionCostModel implements ExecutionCostModel {
  private static final double BASE_SLIPPAGE = 0.0005;
  private static final double BASE_DELAY_MS = 50;
  private static final double IMPACT_FACTOR = 0.1;
  private static final double MAX_IMPACT = 0.05;

  private static final ImmutableMap<VolatilityRegime, Double> SLIPPAGE_BY_VOLATILITY =
      ImmutableMap.of(
          VolatilityRegime.LOW, 1.0,
          VolatilityRegime.MEDIUM, 1.5,
          VolatilityRegime.HIGH, 2.0,
          VolatilityRegime.VERY_HIGH, 3.0);

  private static final ImmutableMap<VolatilityRegime, Double> DELAY_BY_VOLATILITY =
      ImmutableMap.of(
          VolatilityRegime.LOW, 1.0,
          VolatilityRegime.MEDIUM, 1.2,
          VolatilityRegime.HIGH, 1.5,
          VolatilityRegime.VERY_HIGH, 2.0);

  private static final ImmutableMap<Timeframe, Double> SLIPPAGE_BY_TIMEFRAME =
      ImmutableMap.of(
          Timeframe.M1, 1.0,
          Timeframe.M5, 0.8,
          Timeframe.M15, 0.6,
          Timeframe.H1, 0.4,
          Timeframe.H4, 0.3,
          Timeframe.D1, 0.2);

  @Inject
  DefaultExecutionCostModel() {}

  @Override
  public double slippage(MarketConfig market) {
    return BASE_SLIPPAGE
        * SLIPPAGE_BY_VOLATILITY.getOrDefault(market.volatilityRegime(), 1.0)
        * SLIPPAGE_BY_TIMEFRAME.getOrDefault(market.timeframe(), 1.0);
  }

  @Override
  public double executionDelayMs(MarketConfig market) {
    return BASE_DELAY_MS * DELAY_BY_VOLATILITY.getOrDefault(market.volatilityRegime(), 1.0);
  }

  @Override
  public double marketImpact(List<Trade> trades, List<Candle> candles) {
    if (trades.isEmpty() || candles.isEmpty()) {
      return 0.0;
    }
    double avgVolume = candles.stream().mapToDouble(Candle::volume).average().orElse(0);
    if (avgVolume <= 0) {
      return 0.0;
    }
    double avgSize =
        trades.stream().mapToDouble(trade -> Math.abs(trade.size())).average().orElse(0);
    return Math.min(avgSize / avgVolume * IMPACT_FACTOR, MAX_IMPACT);
  }
}
