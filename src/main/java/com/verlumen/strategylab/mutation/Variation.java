package com.verlumen.strategylab.mutation;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/** Mutated content before it is wrapped in a child genome. */
@AutoValue
abstract class Variation {
  static Variation create(String source, Map<String, Double> parameters) {
    return new AutoValue_Variation(source, ImmutableMap.copyOf(parameters));
  }

  abstract String source();

  abstract ImmutableMap<String, Double> parameters();
}
