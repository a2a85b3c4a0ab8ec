package com.verlumen.strategylab.evaluation;

import com.google.common.collect.ImmutableList;
import com.verlumen.strategylab.genome.CandidateKey;
import com.verlumen.strategylab.marketdata.MarketConfig;
import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Evaluates candidate versions across markets on a shared, fixed-size worker pool. Every
 * successful per-market record is appended to the registry as soon as it is produced.
 */
public interface ConcurrentEvaluator {
  /** The diversity-sampled markets used when none are given. */
  ImmutableList<MarketConfig> defaultMarkets();

  AggregatedMetrics evaluate(CandidateKey key) throws EvaluationException;

  /**
   * Aggregates over the markets that succeed. Failed markets are reported in {@link
   * AggregatedMetrics#failures()}.
   *
   * @throws EvaluationException if the version is unknown or every market fails
   */
  AggregatedMetrics evaluate(CandidateKey key, List<MarketConfig> markets)
      throws EvaluationException;

  /**
   * Runs the markets and returns raw outcomes, which may be empty when every market fails.
   *
   * @throws EvaluationException if the version is unknown
   */
  MarketRun evaluateMarkets(CandidateKey key, List<MarketConfig> markets)
      throws EvaluationException;

  /**
   * Evaluates every candidate on the default markets under one worker budget. Runs still pending
   * when {@code timeout} elapses are cancelled; records already written are kept. Repeated keys
   * are evaluated once.
   *
   * @throws com.verlumen.strategylab.registry.RegistryException if a record cannot be written
   */
  BatchEvaluation batchEvaluate(Collection<CandidateKey> population, Duration timeout);

  /** Stops the worker pool, waiting briefly for in-flight runs. */
  void shutdown();
}
