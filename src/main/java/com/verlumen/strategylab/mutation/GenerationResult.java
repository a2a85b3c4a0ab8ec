package com.verlumen.strategylab.mutation;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;

/** Outcome of one generative call. Failures are values, never exceptions. */
@AutoValue
public abstract class GenerationResult {
  public static GenerationResult success(String text, Map<String, Integer> usage) {
    return new AutoValue_GenerationResult(
        true, text, ImmutableMap.copyOf(usage), Optional.empty(), false);
  }

  /**
   * @param retryable whether another attempt could plausibly succeed; false when the service is
   *     unreachable or disabled
   */
  public static GenerationResult failure(String error, boolean retryable) {
    return new AutoValue_GenerationResult(
        false, "", ImmutableMap.of(), Optional.of(error), retryable);
  }

  public abstract boolean success();

  public abstract String text();

  /** Token counts as reported by the service, e.g. {@code prompt_tokens}. */
  public abstract ImmutableMap<String, Integer> usage();

  public abstract Optional<String> error();

  public abstract boolean retryable();
}
