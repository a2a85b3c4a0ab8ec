package com.verlumen.strategylab.evaluation;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.inject.Inject;
import com.verlumen.strategylab.genome.CandidateKey;
import com.verlumen.strategylab.genome.Version;
import com.verlumen.strategylab.marketdata.Candle;
import com.verlumen.strategylab.marketdata.MarketConfig;
import com.verlumen.strategylab.marketdata.MarketDataCache;
import com.verlumen.strategylab.marketdata.MarketDataException;
import com.verlumen.strategylab.marketdata.MarketUniverse;
import com.verlumen.strategylab.registry.CandidateRegistry;
import com.verlumen.strategylab.registry.RegistryException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

final class ConcurrentEvaluatorImpl implements ConcurrentEvaluator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private final ListeningExecutorService workers;
  private final MarketDataCache cache;
  private final CandidateRunner runner;
  private final CandidateRegistry registry;
  private final ImmutableList<MarketConfig> defaultMarkets;

  @Inject
  ConcurrentEvaluatorImpl(
      ListeningExecutorService workers,
      MarketDataCache cache,
      CandidateRunner runner,
      CandidateRegistry registry,
      EvaluatorConfig config) {
    this.workers = workers;
    this.cache = cache;
    this.runner = runner;
    this.registry = registry;
    this.defaultMarkets =
        MarketSampler.diverseSubset(MarketUniverse.defaultMarkets(), config.marketCap());
  }

  @Override
  public ImmutableList<MarketConfig> defaultMarkets() {
    return defaultMarkets;
  }

  @Override
  public AggregatedMetrics evaluate(CandidateKey key) throws EvaluationException {
    return evaluate(key, defaultMarkets);
  }

  @Override
  public AggregatedMetrics evaluate(CandidateKey key, List<MarketConfig> markets)
      throws EvaluationException {
    MarketRun run = evaluateMarkets(key, markets);
    if (run.outcomes().isEmpty()) {
      throw new EvaluationException(allFailedMessage(key, run.failures()));
    }
    AggregatedMetrics metrics =
        MetricsAggregator.aggregate(run.records()).withFailures(run.failures());
    logger.atInfo().log(
        "Evaluated %s on %d/%d markets", key, run.outcomes().size(), run.attempted());
    return metrics;
  }

  @Override
  public MarketRun evaluateMarkets(CandidateKey key, List<MarketConfig> markets)
      throws EvaluationException {
    Version version = requireVersion(key);
    Map<MarketConfig, ListenableFuture<BacktestOutcome>> runs = submit(key, version, markets);
    try {
      Futures.successfulAsList(runs.values()).get();
    } catch (InterruptedException e) {
      runs.values().forEach(future -> future.cancel(true));
      Thread.currentThread().interrupt();
      throw new EvaluationException("Interrupted while evaluating " + key, e);
    } catch (ExecutionException e) {
      throw new EvaluationException("Unexpected failure evaluating " + key, e);
    }
    return collect(key, runs);
  }

  @Override
  public BatchEvaluation batchEvaluate(Collection<CandidateKey> population, Duration timeout) {
    Map<CandidateKey, String> failures = new LinkedHashMap<>();
    Map<CandidateKey, Map<MarketConfig, ListenableFuture<BacktestOutcome>>> runs =
        new LinkedHashMap<>();
    // Cloned elites share a key; each distinct candidate runs once.
    ImmutableSet<CandidateKey> candidates = ImmutableSet.copyOf(population);
    if (candidates.size() < population.size()) {
      logger.atFine().log(
          "Evaluating %d distinct candidates out of %d", candidates.size(), population.size());
    }
    for (CandidateKey key : candidates) {
      Optional<Version> version = registry.version(key.versionId());
      if (version.isEmpty()) {
        failures.put(key, "Unknown version " + key.versionId());
      } else {
        runs.put(key, submit(key, version.get(), defaultMarkets));
      }
    }

    ImmutableList<ListenableFuture<BacktestOutcome>> all =
        runs.values().stream()
            .flatMap(byMarket -> byMarket.values().stream())
            .collect(toImmutableList());
    boolean timedOut = false;
    try {
      Futures.successfulAsList(all).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      timedOut = true;
      logger.atWarning().log("Batch of %d candidates timed out after %s", runs.size(), timeout);
    } catch (InterruptedException e) {
      timedOut = true;
      Thread.currentThread().interrupt();
      logger.atWarning().log("Interrupted while waiting for batch evaluation");
    } catch (ExecutionException e) {
      logger.atSevere().withCause(e).log("Unexpected failure waiting for batch evaluation");
    }
    all.stream().filter(future -> !future.isDone()).forEach(future -> future.cancel(true));

    Map<CandidateKey, AggregatedMetrics> results = new LinkedHashMap<>();
    runs.forEach(
        (key, byMarket) -> {
          MarketRun run = collect(key, byMarket);
          if (run.outcomes().isEmpty()) {
            failures.put(key, allFailedMessage(key, run.failures()));
          } else {
            results.put(
                key, MetricsAggregator.aggregate(run.records()).withFailures(run.failures()));
          }
        });
    logger.atInfo().log(
        "Batch evaluation: %d scored, %d unscored%s",
        results.size(), failures.size(), timedOut ? " (timed out)" : "");
    return BatchEvaluation.create(results, failures, timedOut);
  }

  @Override
  public void shutdown() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private Version requireVersion(CandidateKey key) throws EvaluationException {
    Optional<Version> version = registry.version(key.versionId());
    if (version.isEmpty()) {
      throw new EvaluationException("Unknown version " + key.versionId());
    }
    return version.get();
  }

  private Map<MarketConfig, ListenableFuture<BacktestOutcome>> submit(
      CandidateKey key, Version version, List<MarketConfig> markets) {
    Map<MarketConfig, ListenableFuture<BacktestOutcome>> runs = new LinkedHashMap<>();
    for (MarketConfig market : markets) {
      runs.put(market, workers.submit(() -> runMarket(key, version, market)));
    }
    return runs;
  }

  private BacktestOutcome runMarket(CandidateKey key, Version version, MarketConfig market)
      throws MarketDataException, EvaluationException {
    ImmutableList<Candle> candles = cache.get(market);
    BacktestOutcome outcome = runner.run(version, market, candles);
    registry.recordMetrics(key, outcome.record());
    return outcome;
  }

  /**
   * Reads finished runs; anything failed or cancelled becomes a {@link MarketFailure}.
   *
   * @throws RegistryException if a run could not record its metrics
   */
  private static MarketRun collect(
      CandidateKey key, Map<MarketConfig, ListenableFuture<BacktestOutcome>> runs) {
    List<BacktestOutcome> outcomes = new ArrayList<>();
    List<MarketFailure> failures = new ArrayList<>();
    runs.forEach(
        (market, future) -> {
          try {
            outcomes.add(Futures.getDone(future));
          } catch (CancellationException e) {
            failures.add(MarketFailure.create(market.toString(), "cancelled"));
          } catch (ExecutionException e) {
            if (e.getCause() instanceof RegistryException) {
              logger.atSevere().withCause(e.getCause()).log(
                  "Could not record metrics of %s on %s", key, market);
              throw (RegistryException) e.getCause();
            }
            Throwable cause = Throwables.getRootCause(e);
            logger.atWarning().log("%s failed on %s: %s", key, market, cause.getMessage());
            failures.add(
                MarketFailure.create(market.toString(), String.valueOf(cause.getMessage())));
          }
        });
    return MarketRun.create(outcomes, failures);
  }

  private static String allFailedMessage(CandidateKey key, List<MarketFailure> failures) {
    String firstReason = failures.isEmpty() ? "no markets" : failures.get(0).reason();
    return String.format(
        "All %d markets failed for %s; first: %s", failures.size(), key, firstReason);
  }
}
