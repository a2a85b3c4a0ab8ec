package com.verlumen.strategylab.evaluation;

import com.google.auto.value.AutoValue;
import java.nio.file.Path;
import java.time.Duration;

/** Files prepared for one executor run. The executor writes its results into {@code outputDir}. */
@AutoValue
public abstract class ExecutionRequest {
  public static ExecutionRequest create(
      Path script, Path data, Path parameters, Path outputDir, Duration timeout) {
    return new AutoValue_ExecutionRequest(script, data, parameters, outputDir, timeout);
  }

  public abstract Path script();

  /** Candle CSV with a header row: time, open, high, low, close, volume. */
  public abstract Path data();

  /** JSON object of parameter name to value. */
  public abstract Path parameters();

  public abstract Path outputDir();

  public abstract Duration timeout();
}
