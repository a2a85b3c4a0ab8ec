package com.verlumen.strategylab.tuning;

import com.google.common.collect.ImmutableMap;

/** Scores one parameter assignment; higher is better. */
@FunctionalInterface
public interface TuningObjective {
  double evaluate(ImmutableMap<String, Double> parameters);
}
