package com.verlumen.strategylab.tuning;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.verlumen.strategylab.genome.Genome;
import java.util.Map;

@AutoValue
public abstract class TuningResult {
  static TuningResult create(
      Map<String, Double> bestParameters, double bestScore, long generations) {
    return new AutoValue_TuningResult(ImmutableMap.copyOf(bestParameters), bestScore, generations);
  }

  /** Every parameter of the tuned genome, fixed ones included. */
  public abstract ImmutableMap<String, Double> bestParameters();

  public abstract double bestScore();

  public abstract long generations();

  /** The genome carrying the best parameters. */
  public Genome applyTo(Genome genome) {
    return genome.toBuilder().setParameters(bestParameters()).build();
  }
}
