package com.verlumen.strategylab.deployment;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Combines the stage results into a deployment decision. Pure: the same stage results always
 * produce the same report.
 */
public final class ReadinessScorer {
  static final double APPROVAL_SCORE = 85;
  static final double CONDITIONAL_SCORE = 70;
  private static final double KELLY_MULTIPLIER = 0.25;
  private static final double MISSING_STAGE_PENALTY = 20;

  private final ValidationChecklist checklist;

  @Inject
  public ReadinessScorer(ValidationChecklist checklist) {
    this.checklist = checklist;
  }

  public ReadinessReport assess(StageResults stages) {
    List<CheckResult> checks = new ArrayList<>();
    List<String> criticalFailures = new ArrayList<>();
    List<String> warnings = new ArrayList<>();

    double multiMarketScore =
        stage(stages.multiMarket(), this::multiMarketChecks, "Multi-market validation", checks,
            criticalFailures, warnings);
    double profitScore =
        stage(stages.profit(), this::profitChecks, "Profit analysis", checks, criticalFailures,
            warnings);
    double walkForwardScore =
        stage(stages.walkForward(), this::walkForwardChecks, "Walk-forward validation", checks,
            criticalFailures, warnings);
    double simulationScore =
        stage(stages.simulation(), this::simulationChecks, "Robustness simulation", checks,
            criticalFailures, warnings);
    double riskScore = riskManagementScore(stages);

    double readiness =
        ImmutableList.of(multiMarketScore, profitScore, walkForwardScore, simulationScore, riskScore)
            .stream()
            .mapToDouble(Double::doubleValue)
            .filter(score -> score > 0)
            .average()
            .orElse(0.0);
    DeploymentStatus status = status(readiness, criticalFailures, warnings);
    RiskLevel riskLevel = riskLevel(stages);

    double positionSize = riskLevel.positionSize();
    Optional<Double> kelly =
        stages.profit().flatMap(ProfitMetrics::tradeAnalysis).map(TradeAnalysis::kellyFraction);
    if (kelly.isPresent() && kelly.get() > 0) {
      positionSize = Math.min(positionSize, kelly.get() * KELLY_MULTIPLIER);
    }

    return ReadinessReport.builder()
        .setStatus(status)
        .setRiskLevel(riskLevel)
        .setReadinessScore(readiness)
        .setMultiMarketScore(multiMarketScore)
        .setProfitQualityScore(profitScore)
        .setWalkForwardScore(walkForwardScore)
        .setSimulationScore(simulationScore)
        .setRiskManagementScore(riskScore)
        .setChecks(checks)
        .setCriticalFailures(criticalFailures)
        .setWarnings(warnings)
        .setRecommendations(recommendations(status, stages))
        .setRecommendedPositionSize(positionSize)
        .setRecommendedMaxExposure(riskLevel.maxExposure())
        .setRecommendedDailyLossLimit(riskLevel.dailyLossLimit())
        .build();
  }

  /** Any critical failure rejects; otherwise the score and the warnings decide. */
  static DeploymentStatus status(double score, List<String> criticalFailures, List<String> warnings) {
    if (!criticalFailures.isEmpty()) {
      return DeploymentStatus.REJECTED;
    }
    if (score >= APPROVAL_SCORE && warnings.isEmpty()) {
      return DeploymentStatus.APPROVED;
    }
    if (score >= CONDITIONAL_SCORE) {
      return DeploymentStatus.CONDITIONAL;
    }
    return DeploymentStatus.NEEDS_IMPROVEMENT;
  }

  private static <T> double stage(
      Optional<T> result,
      Function<T, List<CheckResult>> checker,
      String name,
      List<CheckResult> checks,
      List<String> criticalFailures,
      List<String> warnings) {
    if (result.isEmpty()) {
      warnings.add(name + " not performed");
      return 0.0;
    }
    List<CheckResult> stageChecks = checker.apply(result.get());
    checks.addAll(stageChecks);
    int passed = 0;
    for (CheckResult check : stageChecks) {
      if (check.passed()) {
        passed++;
      } else if (check.critical()) {
        criticalFailures.add(check.describe());
      } else {
        warnings.add(check.describe());
      }
    }
    return 100.0 * passed / stageChecks.size();
  }

  private List<CheckResult> multiMarketChecks(MultiMarketResult result) {
    return ImmutableList.of(
        CheckResult.create(
            "Markets passed",
            result.marketsPassed() >= checklist.minMarketsPassed(),
            result.marketsPassed(),
            checklist.minMarketsPassed(),
            true,
            String.format(
                "%d markets passed (need %d)",
                result.marketsPassed(), checklist.minMarketsPassed())),
        CheckResult.create(
            "Overall pass rate",
            result.passRate() >= checklist.minPassRate(),
            result.passRate(),
            checklist.minPassRate(),
            true,
            String.format("Pass rate %.1f%%", result.passRate() * 100)),
        CheckResult.create(
            "Mean Sharpe ratio",
            result.meanSharpe() >= checklist.minMeanSharpe(),
            result.meanSharpe(),
            checklist.minMeanSharpe(),
            false,
            String.format("Mean Sharpe %.2f", result.meanSharpe())),
        CheckResult.create(
            "Mean drawdown",
            result.meanDrawdown() <= checklist.maxMeanDrawdown(),
            result.meanDrawdown(),
            checklist.maxMeanDrawdown(),
            true,
            String.format("Mean drawdown %.1f%%", result.meanDrawdown() * 100)),
        flag(
            "Performance consistency",
            result.performanceConsistent(),
            "Performance is statistically consistent",
            "Performance is inconsistent"));
  }

  private List<CheckResult> profitChecks(ProfitMetrics profit) {
    return ImmutableList.of(
        CheckResult.create(
            "Total return",
            profit.totalReturn() >= checklist.minTotalReturn(),
            profit.totalReturn(),
            checklist.minTotalReturn(),
            true,
            String.format("Total return %.1f%%", profit.totalReturn() * 100)),
        CheckResult.create(
            "Sharpe ratio",
            profit.sharpeRatio() >= checklist.minSharpeRatio(),
            profit.sharpeRatio(),
            checklist.minSharpeRatio(),
            true,
            String.format("Sharpe %.2f", profit.sharpeRatio())),
        CheckResult.create(
            "Profit quality score",
            profit.qualityScore() >= checklist.minQualityScore(),
            profit.qualityScore(),
            checklist.minQualityScore(),
            false,
            String.format("Quality %.1f/100", profit.qualityScore())),
        CheckResult.create(
            "Statistical significance",
            profit.statisticallySignificant() || !checklist.requireSignificance(),
            profit.statisticallySignificant() ? 1.0 : 0.0,
            1.0,
            checklist.requireSignificance(),
            String.format("p-value %.4f", profit.testPValue())));
  }

  private List<CheckResult> walkForwardChecks(WalkForwardResult result) {
    return ImmutableList.of(
        CheckResult.create(
            "Walk-forward pass rate",
            result.passRate() >= checklist.minWalkForwardPassRate(),
            result.passRate(),
            checklist.minWalkForwardPassRate(),
            true,
            String.format("Pass rate %.1f%%", result.passRate() * 100)),
        CheckResult.create(
            "Overfitting score",
            result.overfittingScore() <= checklist.maxOverfittingScore(),
            result.overfittingScore(),
            checklist.maxOverfittingScore(),
            true,
            String.format("Overfitting %.1f/100", result.overfittingScore())),
        CheckResult.create(
            "Performance degradation",
            result.meanDegradation() <= checklist.maxDegradation(),
            result.meanDegradation(),
            checklist.maxDegradation(),
            false,
            String.format("Degradation %.1f%%", result.meanDegradation() * 100)),
        flag(
            "Performance stability",
            result.performanceStable(),
            "Performance is stable",
            "Performance is unstable"));
  }

  private List<CheckResult> simulationChecks(SimulationResult result) {
    return ImmutableList.of(
        CheckResult.create(
            "Probability of profit",
            result.probabilityOfProfit() >= checklist.minProbabilityOfProfit(),
            result.probabilityOfProfit(),
            checklist.minProbabilityOfProfit(),
            true,
            String.format("P(profit) %.1f%%", result.probabilityOfProfit() * 100)),
        CheckResult.create(
            "Probability of ruin",
            result.probabilityOfRuin() <= checklist.maxProbabilityOfRuin(),
            result.probabilityOfRuin(),
            checklist.maxProbabilityOfRuin(),
            true,
            String.format("P(ruin) %.1f%%", result.probabilityOfRuin() * 100)),
        CheckResult.create(
            "Robustness score",
            result.robustnessScore() >= checklist.minRobustnessScore(),
            result.robustnessScore(),
            checklist.minRobustnessScore(),
            false,
            String.format("Robustness %.1f/100", result.robustnessScore())));
  }

  private static CheckResult flag(String name, boolean passed, String yes, String no) {
    return CheckResult.create(name, passed, passed ? 1.0 : 0.0, 1.0, false, passed ? yes : no);
  }

  /** Full marks, less a fixed penalty for each of the first three stages that did not run. */
  private static double riskManagementScore(StageResults stages) {
    double score = 100;
    if (stages.multiMarket().isEmpty()) {
      score -= MISSING_STAGE_PENALTY;
    }
    if (stages.profit().isEmpty()) {
      score -= MISSING_STAGE_PENALTY;
    }
    if (stages.walkForward().isEmpty()) {
      score -= MISSING_STAGE_PENALTY;
    }
    return Math.max(0, score);
  }

  private static RiskLevel riskLevel(StageResults stages) {
    if (stages.multiMarket().isEmpty() || stages.profit().isEmpty()) {
      return RiskLevel.MEDIUM;
    }
    return RiskLevel.forDrawdown(stages.multiMarket().get().maxDrawdown());
  }

  private static ImmutableList<String> recommendations(
      DeploymentStatus status, StageResults stages) {
    ImmutableList.Builder<String> recommendations = ImmutableList.builder();
    switch (status) {
      case APPROVED:
        recommendations.add(
            "Approved for live deployment",
            "Start with the minimum position size and scale up gradually",
            "Monitor performance closely for the first 30 days");
        break;
      case CONDITIONAL:
        recommendations.add(
            "May be deployed with additional monitoring",
            "Use half of the recommended position size",
            "Apply tighter stop-losses initially");
        stages
            .walkForward()
            .filter(result -> result.overfittingScore() > 40)
            .ifPresent(result -> recommendations.add("Simplify parameters to reduce overfitting"));
        break;
      case NEEDS_IMPROVEMENT:
        recommendations.add("Needs improvement before deployment");
        stages
            .multiMarket()
            .filter(result -> result.passRate() < 0.6)
            .ifPresent(result -> recommendations.add("Improve multi-market consistency"));
        stages
            .profit()
            .filter(result -> result.sharpeRatio() < 1.0)
            .ifPresent(result -> recommendations.add("Improve risk-adjusted returns"));
        stages
            .walkForward()
            .filter(WalkForwardResult::overfittingDetected)
            .ifPresent(result -> recommendations.add("Reduce overfitting with simpler logic"));
        break;
      case REJECTED:
        recommendations.add(
            "Rejected: critical checks failed",
            "Do not deploy to live trading",
            "Address every critical failure before resubmitting");
        break;
    }
    return recommendations.build();
  }
}
