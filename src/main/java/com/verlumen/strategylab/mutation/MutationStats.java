package com.verlumen.strategylab.mutation;

import com.google.auto.value.AutoValue;

/** Snapshot of dispatcher counters since start-up. */
@AutoValue
public abstract class MutationStats {
  static MutationStats create(
      int requested, int generative, int fallback, int retries, int rejectedByValidation) {
    return new AutoValue_MutationStats(
        requested, generative, fallback, retries, rejectedByValidation);
  }

  public abstract int requested();

  /** Children whose content came from the generative service. */
  public abstract int generative();

  public abstract int fallback();

  /** Attempts beyond the first, across all requests. */
  public abstract int retries();

  public abstract int rejectedByValidation();

  public double generativeRate() {
    return requested() == 0 ? 0.0 : (double) generative() / requested();
  }
}
