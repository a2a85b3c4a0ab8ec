package com.verlumen.strategylab.evaluation;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Parsed contents of {@code trades.json} and {@code equity.json}. */
@AutoValue
abstract class BacktestOutput {
  static BacktestOutput create(Iterable<Trade> trades, Iterable<Double> equity) {
    return new AutoValue_BacktestOutput(ImmutableList.copyOf(trades), ImmutableList.copyOf(equity));
  }

  abstract ImmutableList<Trade> trades();

  abstract ImmutableList<Double> equity();
}
