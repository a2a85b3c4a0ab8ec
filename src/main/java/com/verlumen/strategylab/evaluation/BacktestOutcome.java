package com.verlumen.strategylab.evaluation;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.strategylab.marketdata.MarketConfig;
import java.util.List;

/**
 * Everything one market run produced: the summary record plus the raw series the deployment gate
 * resamples.
 */
@AutoValue
public abstract class BacktestOutcome {
  public static BacktestOutcome create(
      MarketConfig market, MetricsRecord record, List<Double> equityCurve, List<Double> tradePnls) {
    return new AutoValue_BacktestOutcome(
        market, record, ImmutableList.copyOf(equityCurve), ImmutableList.copyOf(tradePnls));
  }

  public abstract MarketConfig market();

  public abstract MetricsRecord record();

  public abstract ImmutableList<Double> equityCurve();

  public abstract ImmutableList<Double> tradePnls();

  /** Bar-to-bar fractional returns of the equity curve. */
  public ImmutableList<Double> returns() {
    return PerformanceMath.returns(equityCurve());
  }
}
