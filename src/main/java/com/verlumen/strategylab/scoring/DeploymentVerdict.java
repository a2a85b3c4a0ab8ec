package com.verlumen.strategylab.scoring;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Whether a scored candidate clears every hard threshold, with one reason per failure. */
@AutoValue
public abstract class DeploymentVerdict {
  public static DeploymentVerdict create(Iterable<String> reasons) {
    ImmutableList<String> copy = ImmutableList.copyOf(reasons);
    return new AutoValue_DeploymentVerdict(copy.isEmpty(), copy);
  }

  public abstract boolean ready();

  public abstract ImmutableList<String> reasons();
}
