package com.verlumen.strategylab.evaluation;

import com.google.auto.value.AutoValue;

/** One closed trade as reported by the executor. */
@AutoValue
public abstract class Trade {
  public static Trade create(double pnl, double size) {
    return new AutoValue_Trade(pnl, size);
  }

  public abstract double pnl();

  /** Quantity traded, in base units. */
  public abstract double size();
}
