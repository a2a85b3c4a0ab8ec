package com.verlumen.strategylab.evaluation;

import com.google.auto.value.AutoValue;

/** A market that produced no record, and why. */
@AutoValue
public abstract class MarketFailure {
  public static MarketFailure create(String market, String reason) {
    return new AutoValue_MarketFailure(market, reason);
  }

  public abstract String market();

  public abstract String reason();
}
