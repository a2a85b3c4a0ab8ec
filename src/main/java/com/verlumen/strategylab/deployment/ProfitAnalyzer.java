package com.verlumen.strategylab.deployment;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.strategylab.evaluation.PerformanceMath;
import java.util.List;
import java.util.Optional;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.inference.TTest;

/** Stage two of the gate: how good and how real the profit is. */
final class ProfitAnalyzer {
  private static final int PERIODS = PerformanceMath.PERIODS_PER_YEAR;
  private static final double CONFIDENCE = 0.95;
  private static final double SIGNIFICANCE = 0.05;
  private static final double KELLY_CAP = 0.25;

  @Inject
  ProfitAnalyzer() {}

  /**
   * @param returns per-period fractional returns, compounded from 1.0 into the equity curve
   * @param tradePnls per-trade results; may be empty
   */
  ProfitMetrics analyze(List<Double> returns, List<Double> tradePnls) {
    checkArgument(!returns.isEmpty(), "Profit analysis needs at least one return");
    ImmutableList<Double> equity = compound(returns);
    int n = returns.size();
    DescriptiveStatistics stats = new DescriptiveStatistics();
    returns.forEach(stats::addValue);

    double totalReturn = equity.get(equity.size() - 1) / equity.get(0) - 1;
    double annualized = totalReturn / ((double) n / PERIODS);
    double sharpe = PerformanceMath.sharpeRatio(returns);
    double sortino = sortino(returns, stats.getMean());
    double maxDrawdown = PerformanceMath.maxDrawdown(equity);
    double calmar = maxDrawdown == 0 ? Double.POSITIVE_INFINITY : annualized / maxDrawdown;

    double tStatistic = 0.0;
    double pValue = 1.0;
    double std = stats.getStandardDeviation();
    if (n >= 2 && std > 0) {
      TTest test = new TTest();
      tStatistic = test.t(0.0, stats.getValues());
      pValue = test.tTest(0.0, stats.getValues());
    }
    boolean significant = pValue < SIGNIFICANCE;

    double returnMargin = 0.0;
    double sharpeMargin = 0.0;
    if (n >= 2) {
      double tCritical =
          new TDistribution(n - 1).inverseCumulativeProbability(1 - (1 - CONFIDENCE) / 2);
      returnMargin = tCritical * std * Math.sqrt(PERIODS) / Math.sqrt(n);
      double zCritical =
          new NormalDistribution().inverseCumulativeProbability(1 - (1 - CONFIDENCE) / 2);
      sharpeMargin = zCritical * Math.sqrt((1 + 0.5 * sharpe * sharpe) / n);
    }
    double annualMean = stats.getMean() * PERIODS;

    Optional<TradeAnalysis> trades =
        tradePnls.isEmpty() ? Optional.empty() : Optional.of(analyzeTrades(tradePnls));
    double winRate =
        trades.map(TradeAnalysis::winRate).orElse((double) positiveCount(returns) / n);
    double score = qualityScore(totalReturn, sharpe, sortino, calmar, winRate, significant);

    return ProfitMetrics.builder()
        .setPeriods(n)
        .setTotalReturn(totalReturn)
        .setAnnualizedReturn(annualized)
        .setCagr(cagr(equity))
        .setSharpeRatio(sharpe)
        .setSortinoRatio(sortino)
        .setCalmarRatio(calmar)
        .setOmegaRatio(omega(returns))
        .setTestStatistic(tStatistic)
        .setTestPValue(pValue)
        .setStatisticallySignificant(significant)
        .setReturnCiLower(annualMean - returnMargin)
        .setReturnCiUpper(annualMean + returnMargin)
        .setSharpeCiLower(sharpe - sharpeMargin)
        .setSharpeCiUpper(sharpe + sharpeMargin)
        .setTradeAnalysis(trades)
        .setQualityScore(score)
        .setQuality(ProfitQuality.forScore(score))
        .build();
  }

  TradeAnalysis analyzeTrades(List<Double> pnls) {
    int wins = 0;
    int losses = 0;
    double grossProfit = 0;
    double grossLoss = 0;
    for (double pnl : pnls) {
      if (pnl > 0) {
        wins++;
        grossProfit += pnl;
      } else if (pnl < 0) {
        losses++;
        grossLoss -= pnl;
      }
    }
    int total = pnls.size();
    double winRate = (double) wins / total;
    double lossRate = (double) losses / total;
    double avgWin = wins > 0 ? grossProfit / wins : 0.0;
    double avgLoss = losses > 0 ? grossLoss / losses : 0.0;

    double kelly = 0.0;
    if (avgWin > 0 && avgLoss > 0) {
      double ratio = avgWin / avgLoss;
      kelly = Math.max(0.0, Math.min(KELLY_CAP, (winRate * ratio - lossRate) / ratio));
    }
    return TradeAnalysis.builder()
        .setTotalTrades(total)
        .setWinningTrades(wins)
        .setLosingTrades(losses)
        .setWinRate(winRate)
        .setLossRate(lossRate)
        .setGrossProfit(grossProfit)
        .setGrossLoss(grossLoss)
        .setNetProfit(grossProfit - grossLoss)
        .setProfitFactor(grossLoss > 0 ? grossProfit / grossLoss : Double.POSITIVE_INFINITY)
        .setAvgWin(avgWin)
        .setAvgLoss(avgLoss)
        .setLargestWin(pnls.stream().mapToDouble(Double::doubleValue).max().orElse(0.0))
        .setLargestLoss(pnls.stream().mapToDouble(Double::doubleValue).min().orElse(0.0))
        .setMaxConsecutiveWins(longestStreak(pnls, true))
        .setMaxConsecutiveLosses(longestStreak(pnls, false))
        .setRiskRewardRatio(avgLoss > 0 ? avgWin / avgLoss : 0.0)
        .setKellyFraction(kelly)
        .setExpectancy(winRate * avgWin - lossRate * avgLoss)
        .build();
  }

  /** Banded points: return 30, Sharpe 25, Sortino 15, Calmar 15, win rate 10, significance 5. */
  static double qualityScore(
      double totalReturn,
      double sharpe,
      double sortino,
      double calmar,
      double winRate,
      boolean significant) {
    double score = 0;
    score += band(totalReturn, new double[] {1.0, 0.5, 0.2, 0.0}, new double[] {30, 25, 20, 10});
    score += band(sharpe, new double[] {2.0, 1.5, 1.0, 0.5}, new double[] {25, 20, 15, 10});
    score += band(sortino, new double[] {2.5, 1.8, 1.2, 0.8}, new double[] {15, 12, 8, 5});
    score += band(calmar, new double[] {3.0, 2.0, 1.0, 0.5}, new double[] {15, 12, 8, 5});
    score += band(winRate, new double[] {0.6, 0.5, 0.4}, new double[] {10, 7, 5});
    if (significant) {
      score += 5;
    }
    return score;
  }

  /** Points of the first floor the value strictly exceeds. */
  private static double band(double value, double[] floors, double[] points) {
    for (int i = 0; i < floors.length; i++) {
      if (value > floors[i]) {
        return points[i];
      }
    }
    return 0;
  }

  static ImmutableList<Double> compound(List<Double> returns) {
    ImmutableList.Builder<Double> equity = ImmutableList.builder();
    double value = 1.0;
    equity.add(value);
    for (double r : returns) {
      value *= 1 + r;
      equity.add(value);
    }
    return equity.build();
  }

  private static double sortino(List<Double> returns, double mean) {
    DescriptiveStatistics downside = new DescriptiveStatistics();
    returns.stream().filter(r -> r < 0).forEach(downside::addValue);
    if (returns.size() < 2) {
      return 0.0;
    }
    if (downside.getN() == 0) {
      return Double.POSITIVE_INFINITY;
    }
    double std = downside.getStandardDeviation();
    return downside.getN() < 2 || std == 0 ? 0.0 : mean / std * Math.sqrt(PERIODS);
  }

  private static double omega(List<Double> returns) {
    double gains = 0;
    double losses = 0;
    for (double r : returns) {
      if (r > 0) {
        gains += r;
      } else if (r < 0) {
        losses -= r;
      }
    }
    return losses == 0 ? Double.POSITIVE_INFINITY : gains / losses;
  }

  private static double cagr(List<Double> equity) {
    double growth = equity.get(equity.size() - 1) / equity.get(0);
    double years = (double) equity.size() / PERIODS;
    return growth <= 0 ? 0.0 : Math.pow(growth, 1 / years) - 1;
  }

  private static long positiveCount(List<Double> returns) {
    return returns.stream().filter(r -> r > 0).count();
  }

  private static int longestStreak(List<Double> pnls, boolean winning) {
    int longest = 0;
    int current = 0;
    for (double pnl : pnls) {
      if (winning ? pnl > 0 : pnl < 0) {
        current++;
        longest = Math.max(longest, current);
      } else {
        current = 0;
      }
    }
    return longest;
  }
}
