package com.verlumen.strategylab.evaluation;

import com.verlumen.strategylab.marketdata.Candle;
import com.verlumen.strategylab.marketdata.MarketConfig;
import java.util.List;

/** Estimates the real-world frictions a backtest does not simulate. */
public interface ExecutionCostModel {
  /** Expected slippage as a fraction of price. */
  double slippage(MarketConfig market);

  double executionDelayMs(MarketConfig market);

  /** Price impact as a fraction of price, from trade size relative to traded volume. */
  double marketImpact(List<Trade> trades, List<Candle> candles);
}
