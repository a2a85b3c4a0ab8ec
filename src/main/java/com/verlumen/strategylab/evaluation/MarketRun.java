package com.verlumen.strategylab.evaluation;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Per-market outcomes of one candidate, with the markets that failed. */
@AutoValue
public abstract class MarketRun {
  public static MarketRun create(Iterable<BacktestOutcome> outcomes, Iterable<MarketFailure> failures) {
    return new AutoValue_MarketRun(ImmutableList.copyOf(outcomes), ImmutableList.copyOf(failures));
  }

  public abstract ImmutableList<BacktestOutcome> outcomes();

  public abstract ImmutableList<MarketFailure> failures();

  public ImmutableList<MetricsRecord> records() {
    return outcomes().stream().map(BacktestOutcome::record).collect(toImmutableList());
  }

  public int attempted() {
    return outcomes().size() + failures().size();
  }
}
