package com.verlumen.strategylab.deployment;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.strategylab.evaluation.BacktestOutcome;
import com.verlumen.strategylab.evaluation.ConcurrentEvaluator;
import com.verlumen.strategylab.evaluation.EvaluationException;
import com.verlumen.strategylab.evaluation.MarketRun;
import com.verlumen.strategylab.genome.CandidateKey;
import com.verlumen.strategylab.genome.Version;
import com.verlumen.strategylab.marketdata.MarketConfig;
import com.verlumen.strategylab.marketdata.MarketDataCache;
import com.verlumen.strategylab.marketdata.MarketDataException;
import com.verlumen.strategylab.marketdata.MarketUniverse;
import com.verlumen.strategylab.registry.CandidateRegistry;
import java.util.ArrayList;
import java.util.List;

final class DeploymentGateImpl implements DeploymentGate {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ConcurrentEvaluator evaluator;
  private final MarketDataCache marketData;
  private final CandidateRegistry registry;
  private final MultiMarketValidator multiMarketValidator;
  private final ProfitAnalyzer profitAnalyzer;
  private final WalkForwardValidator walkForwardValidator;
  private final MonteCarloSimulator simulator;
  private final ReadinessScorer scorer;
  private final DeploymentConfig config;

  @Inject
  DeploymentGateImpl(
      ConcurrentEvaluator evaluator,
      MarketDataCache marketData,
      CandidateRegistry registry,
      MultiMarketValidator multiMarketValidator,
      ProfitAnalyzer profitAnalyzer,
      WalkForwardValidator walkForwardValidator,
      MonteCarloSimulator simulator,
      ReadinessScorer scorer,
      DeploymentConfig config) {
    this.evaluator = evaluator;
    this.marketData = marketData;
    this.registry = registry;
    this.multiMarketValidator = multiMarketValidator;
    this.profitAnalyzer = profitAnalyzer;
    this.walkForwardValidator = walkForwardValidator;
    this.simulator = simulator;
    this.scorer = scorer;
    this.config = config;
  }

  @Override
  public ReadinessReport assess(CandidateKey key) throws EvaluationException {
    Version version =
        registry
            .version(key.versionId())
            .orElseThrow(() -> new EvaluationException("Unknown version: " + key.versionId()));
    logger.atInfo().log("Assessing %s for deployment", key);

    StageResults.Builder stages = StageResults.builder();
    ImmutableList<MarketConfig> matrix =
        MarketUniverse.standardMatrix(config.matrixLookbackDays(), config.matrixMinDataPoints());
    MarketRun run = evaluator.evaluateMarkets(key, matrix);
    if (run.attempted() > 0) {
      stages.setMultiMarket(multiMarketValidator.validate(run.records(), run.failures().size()));
    }

    List<Double> returns = new ArrayList<>();
    List<Double> tradePnls = new ArrayList<>();
    for (BacktestOutcome outcome : run.outcomes()) {
      returns.addAll(outcome.returns());
      tradePnls.addAll(outcome.tradePnls());
    }
    if (!returns.isEmpty()) {
      stages.setProfit(profitAnalyzer.analyze(returns, tradePnls));
    } else {
      logger.atWarning().log("No returns for %s, skipping profit analysis", key);
    }
    if (returns.size() >= 2) {
      stages.setSimulation(simulator.simulate(returns));
    }

    MarketConfig walkForwardMarket = evaluator.defaultMarkets().get(0);
    try {
      stages.setWalkForward(
          walkForwardValidator.validate(
              version, walkForwardMarket, marketData.get(walkForwardMarket)));
    } catch (MarketDataException | EvaluationException e) {
      logger.atWarning().withCause(e).log(
          "Walk-forward validation of %s on %s did not run", key, walkForwardMarket);
    }

    ReadinessReport report = scorer.assess(stages.build());
    registry.markReady(key, report.ready());
    logger.atInfo().log(
        "%s: %s at %.1f/100 with %d critical failures",
        key, report.status(), report.readinessScore(), report.criticalFailures().size());
    return report;
  }
}
