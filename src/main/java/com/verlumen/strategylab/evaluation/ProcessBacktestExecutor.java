package com.verlumen.strategylab.evaluation;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/** Runs the configured command line as a child process, one process per request. */
final class ProcessBacktestExecutor implements BacktestExecutor {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final int MAX_LOG_CHARS = 4000;

  private final EvaluatorConfig config;

  @Inject
  ProcessBacktestExecutor(EvaluatorConfig config) {
    this.config = config;
  }

  @Override
  public ExecutionResult execute(ExecutionRequest request) throws ExecutorException {
    ImmutableList<String> command = command(request);
    Path logFile = request.outputDir().resolveSibling("executor.log");
    ProcessBuilder builder =
        new ProcessBuilder(command).redirectErrorStream(true).redirectOutput(logFile.toFile());

    Process process;
    try {
      process = builder.start();
    } catch (IOException e) {
      throw new ExecutorException("Could not start " + command.get(0), e);
    }

    try {
      if (!process.waitFor(request.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new ExecutorException("Executor timed out after " + request.timeout());
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new ExecutorException("Interrupted while waiting for executor", e);
    }

    String log = readLog(logFile);
    int exitCode = process.exitValue();
    if (exitCode != 0) {
      throw new ExecutorException("Executor exited with code " + exitCode + ": " + log);
    }
    logger.atFine().log("Executor finished for %s", request.script());
    return ExecutionResult.create(exitCode, request.outputDir(), log);
  }

  private ImmutableList<String> command(ExecutionRequest request) {
    ImmutableMap<String, String> substitutions =
        ImmutableMap.of(
            EvaluatorConfig.SCRIPT, request.script().toString(),
            EvaluatorConfig.DATA, request.data().toString(),
            EvaluatorConfig.PARAMETERS, request.parameters().toString(),
            EvaluatorConfig.OUTPUT, request.outputDir().toString());
    return config.executorCommand().stream()
        .map(token -> substitutions.getOrDefault(token, token))
        .collect(toImmutableList());
  }

  private static String readLog(Path logFile) {
    try {
      String log = Files.readString(logFile, StandardCharsets.UTF_8);
      return log.length() <= MAX_LOG_CHARS ? log : log.substring(log.length() - MAX_LOG_CHARS);
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Could not read executor log %s", logFile);
      return "";
    }
  }
}
