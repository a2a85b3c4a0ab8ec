package com.verlumen.strategylab.tuning;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableMap.toImmutableMap;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/** Closed search interval for one numeric parameter. */
@AutoValue
public abstract class ParameterRange {
  private static final double SPREAD = 0.5;

  public static ParameterRange create(double min, double max) {
    checkArgument(min < max, "Range minimum %s must be below maximum %s", min, max);
    return new AutoValue_ParameterRange(min, max);
  }

  /** Half the value's magnitude on either side; [-1, 1] around zero. */
  public static ParameterRange around(double value) {
    if (value == 0) {
      return create(-1, 1);
    }
    double spread = Math.abs(value) * SPREAD;
    return create(value - spread, value + spread);
  }

  public static ImmutableMap<String, ParameterRange> around(Map<String, Double> parameters) {
    return parameters.entrySet().stream()
        .collect(toImmutableMap(Map.Entry::getKey, entry -> around(entry.getValue())));
  }

  public abstract double min();

  public abstract double max();

  public boolean contains(double value) {
    return value >= min() && value <= max();
  }
}
