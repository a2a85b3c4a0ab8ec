package com.verlumen.strategylab.evaluation;

import com.google.auto.value.AutoValue;
import java.nio.file.Path;

@AutoValue
public abstract class ExecutionResult {
  public static ExecutionResult create(int exitCode, Path outputDir, String log) {
    return new AutoValue_ExecutionResult(exitCode, outputDir, log);
  }

  public abstract int exitCode();

  public abstract Path outputDir();

  /** Combined stdout and stderr, truncated. */
  public abstract String log();
}
