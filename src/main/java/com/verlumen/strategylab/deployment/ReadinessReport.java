package com.verlumen.strategylab.deployment;

import com.google.auto.value.AutoValue;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** The gate's decision with everything that led to it. */
@AutoValue
public abstract class ReadinessReport {
  public abstract DeploymentStatus status();

  public abstract RiskLevel riskLevel();

  /** Mean of the non-zero component scores, 0-100. */
  public abstract double readinessScore();

  public abstract double multiMarketScore();

  public abstract double profitQualityScore();

  public abstract double walkForwardScore();

  public abstract double simulationScore();

  public abstract double riskManagementScore();

  public abstract ImmutableList<CheckResult> checks();

  public abstract ImmutableList<String> criticalFailures();

  public abstract ImmutableList<String> warnings();

  public abstract ImmutableList<String> recommendations();

  public abstract double recommendedPositionSize();

  public abstract double recommendedMaxExposure();

  public abstract double recommendedDailyLossLimit();

  public boolean ready() {
    return status().ready();
  }

  /** Plain-text rendering for logs and the console. */
  public String render() {
    String rule = Strings.repeat("=", 80);
    StringBuilder text = new StringBuilder();
    text.append(rule).append('\n').append("DEPLOYMENT READINESS REPORT\n").append(rule).append('\n');
    text.append(String.format("Status: %s%n", status()));
    text.append(String.format("Risk level: %s%n", riskLevel()));
    text.append(String.format("Readiness score: %.1f/100%n%n", readinessScore()));
    text.append("Component scores:\n");
    text.append(String.format("  Multi-market: %.1f%n", multiMarketScore()));
    text.append(String.format("  Profit quality: %.1f%n", profitQualityScore()));
    text.append(String.format("  Walk-forward: %.1f%n", walkForwardScore()));
    text.append(String.format("  Simulation: %.1f%n", simulationScore()));
    text.append(String.format("  Risk management: %.1f%n", riskManagementScore()));
    appendSection(text, "Critical failures", criticalFailures());
    appendSection(text, "Warnings", warnings());
    text.append("\nRecommended limits:\n");
    text.append(String.format("  Position size: %.1f%% per trade%n", recommendedPositionSize() * 100));
    text.append(String.format("  Max exposure: %.1f%%%n", recommendedMaxExposure() * 100));
    text.append(String.format("  Daily loss limit: %.1f%%%n", recommendedDailyLossLimit() * 100));
    appendSection(text, "Recommendations", recommendations());
    return text.append(rule).toString();
  }

  private static void appendSection(StringBuilder text, String title, List<String> lines) {
    if (lines.isEmpty()) {
      return;
    }
    text.append('\n').append(title).append(":\n");
    lines.forEach(line -> text.append("  - ").append(line).append('\n'));
  }

  static Builder builder() {
    return new AutoValue_ReadinessReport.Builder();
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setStatus(DeploymentStatus value);

    abstract Builder setRiskLevel(RiskLevel value);

    abstract Builder setReadinessScore(double value);

    abstract Builder setMultiMarketScore(double value);

    abstract Builder setProfitQualityScore(double value);

    abstract Builder setWalkForwardScore(double value);

    abstract Builder setSimulationScore(double value);

    abstract Builder setRiskManagementScore(double value);

    abstract Builder setChecks(List<CheckResult> value);

    abstract Builder setCriticalFailures(List<String> value);

    abstract Builder setWarnings(List<String> value);

    abstract Builder setRecommendations(List<String> value);

    abstract Builder setRecommendedPositionSize(double value);

    abstract Builder setRecommendedMaxExposure(double value);

    abstract Builder setRecommendedDailyLossLimit(double value);

    abstract ReadinessReport build();
  }
}
