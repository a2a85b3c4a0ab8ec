package com.verlumen.strategylab.mutation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class SamplingParams {
  public static SamplingParams create(double temperature, double topP, int maxTokens) {
    checkArgument(temperature >= 0, "Temperature cannot be negative");
    checkArgument(topP > 0 && topP <= 1, "topP must be in (0, 1]");
    checkArgument(maxTokens > 0, "maxTokens must be positive");
    return new AutoValue_SamplingParams(temperature, topP, maxTokens);
  }

  public abstract double temperature();

  public abstract double topP();

  public abstract int maxTokens();

  public SamplingParams withTemperature(double temperature) {
    return create(temperature, topP(), maxTokens());
  }
}
