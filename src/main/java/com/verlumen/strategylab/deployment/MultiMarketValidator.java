package com.verlumen.strategylab.deployment;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.strategylab.evaluation.MetricsAggregator;
import com.verlumen.strategylab.evaluation.MetricsRecord;
import com.verlumen.strategylab.scoring.CompositeScorer;
import com.verlumen.strategylab.scoring.FitnessProfile;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/** Stage one of the gate: per-market standards and cross-market statistics. */
final class MultiMarketValidator {
  static final int MIN_TRADES = 10;
  static final double MIN_QUALITY = 60.0;
  static final double MIN_SHARPE = 1.0;
  static final double MAX_DRAWDOWN = 0.5;
  private static final double CONSISTENT_SHARPE_FLOOR = 0.5;
  private static final double Z_95 = 1.96;

  private final CompositeScorer scorer;
  private final FitnessProfile profile;

  @Inject
  MultiMarketValidator(CompositeScorer scorer, FitnessProfile profile) {
    this.scorer = scorer;
    this.profile = profile;
  }

  /**
   * @param records one record per market that ran
   * @param unavailable markets that produced no record; each counts as failed
   */
  MultiMarketResult validate(List<MetricsRecord> records, int unavailable) {
    ImmutableList<MarketVerdict> verdicts =
        records.stream().map(this::verdict).collect(toImmutableList());
    int passed = (int) verdicts.stream().filter(MarketVerdict::passed).count();
    int total = records.size() + unavailable;

    DescriptiveStatistics sharpe = new DescriptiveStatistics();
    DescriptiveStatistics drawdown = new DescriptiveStatistics();
    DescriptiveStatistics winRate = new DescriptiveStatistics();
    DescriptiveStatistics profitFactor = new DescriptiveStatistics();
    for (MetricsRecord record : records) {
      sharpe.addValue(record.sharpeRatio());
      drawdown.addValue(record.maxDrawdown());
      winRate.addValue(record.winRate());
      profitFactor.addValue(record.profitFactor());
    }

    double meanSharpe = orZero(sharpe.getMean());
    double margin =
        records.isEmpty()
            ? 0.0
            : Z_95 * Math.sqrt(sharpe.getPopulationVariance()) / Math.sqrt(records.size());
    double ciLower = meanSharpe - margin;
    return MultiMarketResult.builder()
        .setVerdicts(verdicts)
        .setMarketsPassed(passed)
        .setMarketsFailed(total - passed)
        .setPassRate(total == 0 ? 0.0 : (double) passed / total)
        .setMeanSharpe(meanSharpe)
        .setMedianSharpe(orZero(sharpe.getPercentile(50)))
        .setMinSharpe(orZero(sharpe.getMin()))
        .setMaxSharpe(orZero(sharpe.getMax()))
        .setMeanDrawdown(orZero(drawdown.getMean()))
        .setMaxDrawdown(orZero(drawdown.getMax()))
        .setMeanWinRate(orZero(winRate.getMean()))
        .setMeanProfitFactor(orZero(profitFactor.getMean()))
        .setSharpeCiLower(ciLower)
        .setSharpeCiUpper(meanSharpe + margin)
        .setPerformanceConsistent(!records.isEmpty() && ciLower > CONSISTENT_SHARPE_FLOOR)
        .build();
  }

  private MarketVerdict verdict(MetricsRecord record) {
    double quality =
        100 * scorer.score(MetricsAggregator.aggregate(ImmutableList.of(record)), profile);
    List<String> errors = new ArrayList<>();
    if (record.numTrades() < MIN_TRADES) {
      errors.add(String.format("Too few trades: %d < %d", record.numTrades(), MIN_TRADES));
    }
    if (quality < MIN_QUALITY) {
      errors.add(String.format("Low quality score: %.1f < %.1f", quality, MIN_QUALITY));
    }
    if (record.sharpeRatio() < MIN_SHARPE) {
      errors.add(String.format("Low Sharpe: %.2f < %.2f", record.sharpeRatio(), MIN_SHARPE));
    }
    if (record.maxDrawdown() > MAX_DRAWDOWN) {
      errors.add(String.format("Excessive drawdown: %.1f%%", record.maxDrawdown() * 100));
    }
    return MarketVerdict.create(
        record.market(),
        record.sharpeRatio(),
        record.maxDrawdown(),
        record.numTrades(),
        quality,
        errors);
  }

  /** Empty statistics report NaN. */
  private static double orZero(double value) {
    return Double.isNaN(value) ? 0.0 : value;
  }
}
