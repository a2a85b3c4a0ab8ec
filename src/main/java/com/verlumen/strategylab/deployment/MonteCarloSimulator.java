package com.verlumen.strategylab.deployment;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.inject.Inject;
import com.verlumen.strategylab.evaluation.PerformanceMath;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/** Stage four of the gate: bootstrap resampling of the observed returns. */
final class MonteCarloSimulator {
  private final SimulationConfig config;

  @Inject
  MonteCarloSimulator(SimulationConfig config) {
    this.config = config;
  }

  SimulationResult simulate(List<Double> returns) {
    checkArgument(returns.size() >= 2, "Resampling needs at least two returns");
    Random random = new Random(config.seed());
    DescriptiveStatistics pathReturns = new DescriptiveStatistics();
    DescriptiveStatistics pathSharpes = new DescriptiveStatistics();
    int ruined = 0;
    int profitable = 0;

    int n = returns.size();
    List<Double> sample = new ArrayList<>(n);
    List<Double> equity = new ArrayList<>(n + 1);
    for (int run = 0; run < config.simulations(); run++) {
      sample.clear();
      equity.clear();
      double value = 1.0;
      equity.add(value);
      for (int i = 0; i < n; i++) {
        double r = returns.get(random.nextInt(n));
        sample.add(r);
        value *= 1 + r;
        equity.add(value);
      }
      double total = value - 1;
      pathReturns.addValue(total);
      pathSharpes.addValue(PerformanceMath.sharpeRatio(sample));
      if (total > 0) {
        profitable++;
      }
      if (PerformanceMath.maxDrawdown(equity) > config.ruinDrawdown()) {
        ruined++;
      }
    }

    double tail = (1 - config.confidenceLevel()) / 2 * 100;
    double var95 = pathReturns.getPercentile(5);
    double cvar95 =
        Arrays.stream(pathReturns.getValues()).filter(r -> r <= var95).average().orElse(var95);
    double mean = pathReturns.getMean();
    double std = Math.sqrt(pathReturns.getPopulationVariance());
    double probabilityOfProfit = (double) profitable / config.simulations();
    double probabilityOfRuin = (double) ruined / config.simulations();
    double sharpeLower = pathSharpes.getPercentile(tail);
    return SimulationResult.builder()
        .setSimulations(config.simulations())
        .setMeanReturn(mean)
        .setMedianReturn(pathReturns.getPercentile(50))
        .setStdReturn(std)
        .setMinReturn(pathReturns.getMin())
        .setMaxReturn(pathReturns.getMax())
        .setReturnCiLower(pathReturns.getPercentile(tail))
        .setReturnCiUpper(pathReturns.getPercentile(100 - tail))
        .setSharpeCiLower(sharpeLower)
        .setSharpeCiUpper(pathSharpes.getPercentile(100 - tail))
        .setProbabilityOfProfit(probabilityOfProfit)
        .setProbabilityOfRuin(probabilityOfRuin)
        .setValueAtRisk95(var95)
        .setConditionalValueAtRisk95(cvar95)
        .setRobustnessScore(
            robustnessScore(mean, std, probabilityOfProfit, probabilityOfRuin, sharpeLower))
        .build();
  }

  /** Consistency 30, profit probability 25, survival 25, Sharpe lower bound 20. */
  static double robustnessScore(
      double mean,
      double std,
      double probabilityOfProfit,
      double probabilityOfRuin,
      double sharpeLower) {
    double variation = std / (Math.abs(mean) + 1e-6);
    double consistency = Math.max(0, 30 * (1 - Math.min(1, variation)));
    double profit = probabilityOfProfit * 25;
    double survival = (1 - probabilityOfRuin) * 25;
    double sharpe = Math.max(0, Math.min(20, sharpeLower * 10));
    return Math.max(0, Math.min(100, consistency + profit + survival + sharpe));
  }
}
