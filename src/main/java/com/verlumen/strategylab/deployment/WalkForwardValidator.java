package com.verlumen.strategylab.deployment;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.strategylab.evaluation.BacktestOutcome;
import com.verlumen.strategylab.evaluation.CandidateRunner;
import com.verlumen.strategylab.evaluation.EvaluationException;
import com.verlumen.strategylab.evaluation.PerformanceMath;
import com.verlumen.strategylab.genome.Version;
import com.verlumen.strategylab.marketdata.Candle;
import com.verlumen.strategylab.marketdata.MarketConfig;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/**
 * Stage three of the gate: runs the version on consecutive in-sample and out-of-sample slices of
 * one market and measures how much performance degrades out of sample.
 */
final class WalkForwardValidator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final double STABLE_CONSISTENCY = 0.5;
  private static final double STABLE_PASS_RATE = 0.6;

  private final CandidateRunner runner;
  private final OverfittingPolicy policy;
  private final WalkForwardConfig config;

  @Inject
  WalkForwardValidator(CandidateRunner runner, OverfittingPolicy policy, WalkForwardConfig config) {
    this.runner = runner;
    this.policy = policy;
    this.config = config;
  }

  /**
   * @throws EvaluationException if there are too few candles or every period fails to run
   */
  WalkForwardResult validate(Version version, MarketConfig market, List<Candle> candles)
      throws EvaluationException {
    if (candles.size() < config.minBars()) {
      throw new EvaluationException(
          String.format(
              "Walk-forward needs %d bars, %s has %d",
              config.minBars(), market, candles.size()));
    }
    int window = candles.size() / config.periods();
    int inSampleSize = (int) (window * config.inSampleRatio());
    int outOfSampleSize = window - inSampleSize;

    List<WalkForwardPeriod> periods = new ArrayList<>();
    for (int i = 0; i < config.periods(); i++) {
      int inStart = config.anchored() ? 0 : i * window;
      int inEnd = config.anchored() ? inSampleSize + i * outOfSampleSize : inStart + inSampleSize;
      int outEnd = Math.min(inEnd + outOfSampleSize, candles.size());
      if (outEnd - inEnd < config.minOutOfSampleBars()) {
        logger.atFine().log("Walk-forward period %d: too few out-of-sample bars, skipping", i);
        continue;
      }
      try {
        BacktestOutcome inSample = runner.run(version, market, candles.subList(inStart, inEnd));
        BacktestOutcome outOfSample = runner.run(version, market, candles.subList(inEnd, outEnd));
        periods.add(period(i, inStart, inEnd, outEnd, inSample, outOfSample));
      } catch (EvaluationException e) {
        logger.atWarning().withCause(e).log("Walk-forward period %d of %s failed", i, market);
      }
    }
    if (periods.isEmpty()) {
      throw new EvaluationException("Every walk-forward period failed on " + market);
    }
    return aggregate(periods);
  }

  private WalkForwardPeriod period(
      int index,
      int inStart,
      int inEnd,
      int outEnd,
      BacktestOutcome inSample,
      BacktestOutcome outOfSample) {
    double inReturn = totalReturn(inSample.equityCurve());
    double outReturn = totalReturn(outOfSample.equityCurve());
    double inSharpe = PerformanceMath.sharpeRatio(inSample.returns());
    double outSharpe = PerformanceMath.sharpeRatio(outOfSample.returns());
    double degradation = degradation(inReturn, outReturn);
    return WalkForwardPeriod.builder()
        .setIndex(index)
        .setInSampleStart(inStart)
        .setInSampleEnd(inEnd)
        .setOutOfSampleStart(inEnd)
        .setOutOfSampleEnd(outEnd)
        .setInSampleReturn(inReturn)
        .setOutOfSampleReturn(outReturn)
        .setInSampleSharpe(inSharpe)
        .setOutOfSampleSharpe(outSharpe)
        .setInSampleDrawdown(PerformanceMath.maxDrawdown(inSample.equityCurve()))
        .setOutOfSampleDrawdown(PerformanceMath.maxDrawdown(outOfSample.equityCurve()))
        .setReturnDegradation(degradation)
        .setSharpeDegradation(degradation(inSharpe, outSharpe))
        .setPassed(
            outReturn >= config.minOutOfSampleReturn()
                && outSharpe >= config.minOutOfSampleSharpe()
                && degradation <= config.maxPeriodDegradation())
        .build();
  }

  private WalkForwardResult aggregate(List<WalkForwardPeriod> periods) {
    DescriptiveStatistics inReturns = new DescriptiveStatistics();
    DescriptiveStatistics outReturns = new DescriptiveStatistics();
    DescriptiveStatistics inSharpes = new DescriptiveStatistics();
    DescriptiveStatistics outSharpes = new DescriptiveStatistics();
    DescriptiveStatistics degradations = new DescriptiveStatistics();
    DescriptiveStatistics sharpeDegradations = new DescriptiveStatistics();
    int passed = 0;
    for (WalkForwardPeriod period : periods) {
      inReturns.addValue(period.inSampleReturn());
      outReturns.addValue(period.outOfSampleReturn());
      inSharpes.addValue(period.inSampleSharpe());
      outSharpes.addValue(period.outOfSampleSharpe());
      degradations.addValue(period.returnDegradation());
      sharpeDegradations.addValue(period.sharpeDegradation());
      if (period.passed()) {
        passed++;
      }
    }
    double passRate = (double) passed / periods.size();
    double degradationStd = Math.sqrt(degradations.getPopulationVariance());
    double consistency =
        1.0
            - Math.sqrt(outReturns.getPopulationVariance())
                / (Math.abs(outReturns.getMean()) + 1e-6);
    return WalkForwardResult.builder()
        .setPeriods(ImmutableList.copyOf(periods))
        .setPeriodsPassed(passed)
        .setPassRate(passRate)
        .setMeanInSampleReturn(inReturns.getMean())
        .setMeanOutOfSampleReturn(outReturns.getMean())
        .setMeanInSampleSharpe(inSharpes.getMean())
        .setMeanOutOfSampleSharpe(outSharpes.getMean())
        .setMeanDegradation(degradations.getMean())
        .setMeanSharpeDegradation(sharpeDegradations.getMean())
        .setDegradationStd(degradationStd)
        .setOverfittingScore(policy.score(degradations.getMean(), degradationStd, passRate))
        .setOutOfSampleConsistency(consistency)
        .setPerformanceStable(consistency > STABLE_CONSISTENCY && passRate > STABLE_PASS_RATE)
        .build();
  }

  private static double totalReturn(List<Double> equity) {
    if (equity.size() < 2 || equity.get(0) == 0) {
      return 0.0;
    }
    return equity.get(equity.size() - 1) / equity.get(0) - 1;
  }

  private static double degradation(double inSample, double outOfSample) {
    return inSample == 0 ? 0.0 : (inSample - outOfSample) / Math.abs(inSample);
  }
}
