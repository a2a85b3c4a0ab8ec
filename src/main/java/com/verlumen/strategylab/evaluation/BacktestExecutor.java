package com.verlumen.strategylab.evaluation;

/** Runs a signal program over a candle file and leaves its output files in the output directory. */
public interface BacktestExecutor {
  ExecutionResult execute(ExecutionRequest request) throws ExecutorException;
}
