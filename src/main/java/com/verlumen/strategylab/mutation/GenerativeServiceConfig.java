package com.verlumen.strategylab.mutation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.time.Duration;

@AutoValue
public abstract class GenerativeServiceConfig {
  public static final String DEFAULT_ENDPOINT = "http://127.0.0.1:1234";
  public static final String DEFAULT_MODEL = "deepseek/deepseek-r1-0528-qwen3-8b";

  public static GenerativeServiceConfig create(
      String endpoint,
      String model,
      String apiKey,
      Duration timeout,
      int maxRetries,
      SamplingParams sampling) {
    checkArgument(maxRetries >= 1, "At least one attempt is required");
    return new AutoValue_GenerativeServiceConfig(
        endpoint, model, apiKey, timeout, maxRetries, sampling);
  }

  public static GenerativeServiceConfig defaults() {
    return create(
        DEFAULT_ENDPOINT,
        DEFAULT_MODEL,
        "",
        Duration.ofSeconds(60),
        3,
        SamplingParams.create(0.7, 0.9, 2000));
  }

  /** Base URL of an OpenAI-compatible server. */
  public abstract String endpoint();

  public abstract String model();

  /** Bearer token; empty for local servers. */
  public abstract String apiKey();

  public abstract Duration timeout();

  public abstract int maxRetries();

  public abstract SamplingParams sampling();
}
