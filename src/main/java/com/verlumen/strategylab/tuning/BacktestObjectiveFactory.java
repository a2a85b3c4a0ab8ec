package com.verlumen.strategylab.tuning;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.strategylab.evaluation.CandidateRunner;
import com.verlumen.strategylab.evaluation.EvaluationException;
import com.verlumen.strategylab.evaluation.MetricsAggregator;
import com.verlumen.strategylab.evaluation.MetricsRecord;
import com.verlumen.strategylab.genome.CommitHashes;
import com.verlumen.strategylab.genome.Genome;
import com.verlumen.strategylab.genome.Version;
import com.verlumen.strategylab.marketdata.Candle;
import com.verlumen.strategylab.marketdata.MarketConfig;
import com.verlumen.strategylab.marketdata.MarketDataCache;
import com.verlumen.strategylab.marketdata.MarketDataException;
import com.verlumen.strategylab.scoring.CompositeScorer;
import com.verlumen.strategylab.scoring.FitnessProfile;
import java.time.Clock;
import java.util.Optional;

/**
 * Builds objectives that backtest a version with substituted parameters on one market and score
 * the run. Nothing is written to the registry.
 */
public final class BacktestObjectiveFactory {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final CandidateRunner runner;
  private final MarketDataCache marketData;
  private final CompositeScorer scorer;
  private final FitnessProfile profile;
  private final Clock clock;

  @Inject
  BacktestObjectiveFactory(
      CandidateRunner runner,
      MarketDataCache marketData,
      CompositeScorer scorer,
      FitnessProfile profile,
      Clock clock) {
    this.runner = runner;
    this.marketData = marketData;
    this.scorer = scorer;
    this.profile = profile;
    this.clock = clock;
  }

  /** Tunes an unsaved genome through a transient version of it. */
  public TuningObjective create(Genome genome, MarketConfig market) throws MarketDataException {
    Version base =
        Version.builder()
            .setId(genome.lineageId())
            .setGenomeId(genome.lineageId())
            .setVersionNumber(0)
            .setParentVersionId(Optional.empty())
            .setCommitHash(CommitHashes.of(genome.source(), genome.parameters()))
            .setSource(genome.source())
            .setParameters(genome.parameters())
            .setCreatedAt(clock.instant())
            .build();
    return create(base, market);
  }

  /**
   * Candles are fetched once, up front. A run that fails scores zero.
   *
   * @throws MarketDataException if the market's candles cannot be fetched
   */
  public TuningObjective create(Version base, MarketConfig market) throws MarketDataException {
    ImmutableList<Candle> candles = marketData.get(market);
    return parameters -> {
      Version trial =
          base.toBuilder()
              .setId(base.id() + "-tuning")
              .setParentVersionId(Optional.of(base.id()))
              .setCommitHash(CommitHashes.of(base.source(), parameters))
              .setParameters(parameters)
              .setCreatedAt(clock.instant())
              .build();
      try {
        MetricsRecord record = runner.run(trial, market, candles).record();
        return scorer.score(MetricsAggregator.aggregate(ImmutableList.of(record)), profile);
      } catch (EvaluationException e) {
        logger.atFine().withCause(e).log("Tuning trial %s failed, scoring zero", parameters);
        return 0.0;
      }
    };
  }
}
