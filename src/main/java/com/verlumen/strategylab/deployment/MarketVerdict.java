package com.verlumen.strategylab.deployment;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Whether one market of the validation matrix met the per-market standards. */
@AutoValue
public abstract class MarketVerdict {
  static MarketVerdict create(
      String market,
      double sharpeRatio,
      double maxDrawdown,
      int numTrades,
      double qualityScore,
      List<String> errors) {
    return new AutoValue_MarketVerdict(
        market,
        sharpeRatio,
        maxDrawdown,
        numTrades,
        qualityScore,
        ImmutableList.copyOf(errors));
  }

  public abstract String market();

  public abstract double sharpeRatio();

  public abstract double maxDrawdown();

  public abstract int numTrades();

  /** Composite fitness scaled to 0-100. */
  public abstract double qualityScore();

  public abstract ImmutableList<String> errors();

  public boolean passed() {
    return errors().isEmpty();
  }
}
