package com.verlumen.strategylab.scoring;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.strategylab.evaluation.AggregatedMetrics;

final class CompositeScorerImpl implements CompositeScorer {
  private static final double CONSISTENCY_FLOOR = 0.1;

  @Inject
  CompositeScorerImpl() {}

  @Override
  public double score(AggregatedMetrics metrics, FitnessProfile profile) {
    double score = 0;
    for (Criterion criterion : Criterion.values()) {
      double weight = profile.weight(criterion);
      if (weight > 0) {
        score += weight * normalize(criterion, metrics, profile);
      }
    }
    return clamp(score);
  }

  @Override
  public double normalize(Criterion criterion, AggregatedMetrics metrics, FitnessProfile profile) {
    double ratio = ratio(criterion, metrics, profile);
    return clamp(criterion.lowerIsBetter() ? 1 - ratio : ratio);
  }

  /** The raw metric relative to its normalization bound, before inversion. */
  private static double ratio(
      Criterion criterion, AggregatedMetrics metrics, FitnessProfile profile) {
    NormalizationRanges ranges = profile.normalization();
    switch (criterion) {
      case PNL:
        return metrics.totalPnl() / ranges.pnlMax();
      case SHARPE_RATIO:
        return metrics.sharpeRatio() / ranges.sharpeMax();
      case MAX_DRAWDOWN:
        return metrics.maxDrawdown() / profile.thresholds().maxDrawdown();
      case WIN_RATE:
        return metrics.winRate();
      case CONSISTENCY:
        // Downside deviation per unit of volatility-adjusted return.
        return Math.min(
            1,
            metrics.downsideDeviation()
                / Math.max(metrics.volatilityAdjustedReturn(), CONSISTENCY_FLOOR));
      case TRADE_FREQUENCY:
        return metrics.avgTradesPerMarket() / ranges.tradeFrequencyMax();
      case SLIPPAGE_RESISTANCE:
        return metrics.slippage() / ranges.slippageTolerance();
      case EXECUTION_SPEED:
        return metrics.executionDelayMs() / ranges.executionDelayMaxMs();
      case MARKET_DIVERSITY:
        return (double) metrics.marketsTested().size() / ranges.diversityTarget();
    }
    throw new AssertionError(criterion);
  }

  @Override
  public DeploymentVerdict isDeploymentReady(
      double score, AggregatedMetrics metrics, FitnessProfile profile) {
    DeploymentThresholds thresholds = profile.thresholds();
    ImmutableList.Builder<String> reasons = ImmutableList.builder();
    if (score < thresholds.minFitness()) {
      reasons.add(String.format("Low fitness: %.3f < %.3f", score, thresholds.minFitness()));
    }
    if (metrics.sharpeRatio() < thresholds.minSharpeRatio()) {
      reasons.add(String.format("Low Sharpe: %.2f", metrics.sharpeRatio()));
    }
    if (metrics.winRate() < thresholds.minWinRate()) {
      reasons.add(String.format("Low win rate: %.1f%%", metrics.winRate() * 100));
    }
    if (metrics.maxDrawdown() > thresholds.maxDrawdown()) {
      reasons.add(String.format("High drawdown: %.1f%%", metrics.maxDrawdown() * 100));
    }
    int markets = metrics.marketsTested().size();
    if (markets < thresholds.minMarketsTested()) {
      reasons.add(String.format("Insufficient market testing: %d markets", markets));
    }
    if (metrics.avgTradesPerMarket() < thresholds.minTradesPerMarket()) {
      reasons.add(String.format("Low trades per market: %.1f", metrics.avgTradesPerMarket()));
    }
    if (metrics.numTrades() < thresholds.minTotalTrades()) {
      reasons.add(String.format("Low total trades: %d", metrics.numTrades()));
    }
    if (metrics.slippage() > thresholds.maxSlippage()) {
      reasons.add(String.format("High slippage: %.4f", metrics.slippage()));
    }
    if (metrics.executionDelayMs() > thresholds.maxExecutionDelayMs()) {
      reasons.add(String.format("Slow execution: %.0fms", metrics.executionDelayMs()));
    }
    if (metrics.marketImpact() > thresholds.maxMarketImpact()) {
      reasons.add(String.format("High market impact: %.4f", metrics.marketImpact()));
    }
    return DeploymentVerdict.create(reasons.build());
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
