package com.verlumen.strategylab.evaluation;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/** Return-series statistics shared by the runner and the deployment gate. */
public final class PerformanceMath {
  public static final int PERIODS_PER_YEAR = 252;
  public static final double RISK_FREE_RATE = 0.02;

  /** Fractional change between consecutive points; steps from a zero value are skipped. */
  public static ImmutableList<Double> returns(List<Double> series) {
    ImmutableList.Builder<Double> returns = ImmutableList.builder();
    for (int i = 1; i < series.size(); i++) {
      double previous = series.get(i - 1);
      if (previous != 0) {
        returns.add(series.get(i) / previous - 1);
      }
    }
    return returns.build();
  }

  /** Annualized Sharpe ratio over per-period returns; 0 for fewer than two returns or no spread. */
  public static double sharpeRatio(List<Double> returns) {
    if (returns.size() < 2) {
      return 0.0;
    }
    DescriptiveStatistics stats = stats(returns);
    double std = stats.getStandardDeviation();
    if (std == 0 || !Double.isFinite(std)) {
      return 0.0;
    }
    double excessMean = stats.getMean() - RISK_FREE_RATE / PERIODS_PER_YEAR;
    return excessMean / std * Math.sqrt(PERIODS_PER_YEAR);
  }

  /** Deepest peak-to-trough fall relative to the highest peak, in [0, 1]. */
  public static double maxDrawdown(List<Double> equity) {
    double peak = Double.NEGATIVE_INFINITY;
    double deepest = 0;
    for (double value : equity) {
      peak = Math.max(peak, value);
      deepest = Math.max(deepest, peak - value);
    }
    if (equity.isEmpty() || peak <= 0) {
      return 0.0;
    }
    return Math.min(1.0, deepest / peak);
  }

  public static double downsideDeviation(List<Double> returns) {
    DescriptiveStatistics losses = new DescriptiveStatistics();
    returns.stream().filter(r -> r < 0).forEach(losses::addValue);
    return losses.getN() < 2 ? 0.0 : losses.getStandardDeviation();
  }

  /** Mean return per unit of standard deviation, not annualized. */
  public static double volatilityAdjustedReturn(List<Double> returns) {
    if (returns.size() < 2) {
      return 0.0;
    }
    DescriptiveStatistics stats = stats(returns);
    double std = stats.getStandardDeviation();
    return std == 0 ? 0.0 : stats.getMean() / std;
  }

  /** Gross profit over gross loss; 1 when there are no wins or no losses. */
  public static double profitFactor(List<Double> tradePnls) {
    double gains = 0;
    double losses = 0;
    for (double pnl : tradePnls) {
      if (pnl > 0) {
        gains += pnl;
      } else if (pnl < 0) {
        losses -= pnl;
      }
    }
    return gains > 0 && losses > 0 ? gains / losses : 1.0;
  }

  public static double winRate(List<Double> tradePnls) {
    if (tradePnls.isEmpty()) {
      return 0.0;
    }
    return (double) tradePnls.stream().filter(pnl -> pnl > 0).count() / tradePnls.size();
  }

  static DescriptiveStatistics stats(List<Double> values) {
    DescriptiveStatistics stats = new DescriptiveStatistics();
    values.forEach(stats::addValue);
    return stats;
  }

  private PerformanceMath() {}
}
