package com.verlumen.strategylab.deployment;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ReadinessScorerTest {
  private final ReadinessScorer scorer = new ReadinessScorer(ValidationChecklist.defaults());

  @Test
  public void assess_everyCheckPasses_isApproved() {
    // Act
    ReadinessReport report = scorer.assess(TestStages.allStages().build());

    // Assert
    assertThat(report.status()).isEqualTo(DeploymentStatus.APPROVED);
    assertThat(report.readinessScore()).isWithin(1e-9).of(100.0);
    assertThat(report.criticalFailures()).isEmpty();
    assertThat(report.warnings()).isEmpty();
    assertThat(report.checks()).hasSize(16);
    assertThat(report.ready()).isTrue();
  }

  @Test
  public void assess_criticalDrawdownFailure_isRejectedDespiteHighScore() {
    // Arrange
    StageResults stages =
        TestStages.allStages()
            .setMultiMarket(TestStages.multiMarket().setMeanDrawdown(0.35).build())
            .build();

    // Act
    ReadinessReport report = scorer.assess(stages);

    // Assert
    assertThat(report.readinessScore()).isAtLeast(95.0);
    assertThat(report.status()).isEqualTo(DeploymentStatus.REJECTED);
    assertThat(report.criticalFailures()).hasSize(1);
    assertThat(report.criticalFailures().get(0)).startsWith("Mean drawdown");
    assertThat(report.ready()).isFalse();
  }

  @Test
  public void assess_nonCriticalFailure_isConditional() {
    // Arrange
    StageResults stages =
        TestStages.allStages()
            .setSimulation(TestStages.simulation().setRobustnessScore(50).build())
            .build();

    // Act
    ReadinessReport report = scorer.assess(stages);

    // Assert
    assertThat(report.status()).isEqualTo(DeploymentStatus.CONDITIONAL);
    assertThat(report.simulationScore()).isWithin(1e-6).of(200.0 / 3);
    assertThat(report.criticalFailures()).isEmpty();
    assertThat(report.warnings()).containsExactly("Robustness score: Robustness 50.0/100");
    assertThat(report.ready()).isTrue();
  }

  @Test
  public void assess_missingStage_warnsAndPenalizesRiskManagement() {
    // Arrange
    StageResults stages =
        StageResults.builder()
            .setMultiMarket(TestStages.multiMarket().build())
            .setProfit(TestStages.profit().build())
            .setSimulation(TestStages.simulation().build())
            .build();

    // Act
    ReadinessReport report = scorer.assess(stages);

    // Assert
    assertThat(report.warnings()).containsExactly("Walk-forward validation not performed");
    assertThat(report.walkForwardScore()).isEqualTo(0.0);
    assertThat(report.riskManagementScore()).isEqualTo(80.0);
    assertThat(report.readinessScore()).isWithin(1e-9).of(95.0);
    assertThat(report.status()).isEqualTo(DeploymentStatus.CONDITIONAL);
  }

  @Test
  public void assess_noStages_needsImprovementAtMediumRisk() {
    // Act
    ReadinessReport report = scorer.assess(StageResults.builder().build());

    // Assert
    assertThat(report.status()).isEqualTo(DeploymentStatus.NEEDS_IMPROVEMENT);
    assertThat(report.readinessScore()).isWithin(1e-9).of(40.0);
    assertThat(report.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
    assertThat(report.warnings()).hasSize(4);
    assertThat(report.checks()).isEmpty();
  }

  @Test
  public void assess_insignificantReturns_areCriticalOnlyWhenRequired() {
    // Arrange
    StageResults stages =
        TestStages.allStages()
            .setProfit(
                TestStages.profit().setStatisticallySignificant(false).setTestPValue(0.3).build())
            .build();
    ReadinessScorer lenient =
        new ReadinessScorer(
            ValidationChecklist.defaults().toBuilder().setRequireSignificance(false).build());

    // Act
    ReadinessReport strictReport = scorer.assess(stages);
    ReadinessReport lenientReport = lenient.assess(stages);

    // Assert
    assertThat(strictReport.status()).isEqualTo(DeploymentStatus.REJECTED);
    assertThat(lenientReport.status()).isEqualTo(DeploymentStatus.APPROVED);
  }

  @Test
  public void assess_lowDrawdown_sizesByRiskLevelAndKelly() {
    // Arrange
    StageResults stages =
        TestStages.allStages()
            .setProfit(
                TestStages.profit()
                    .setTradeAnalysis(Optional.of(TestStages.trades().setKellyFraction(0.04).build()))
                    .build())
            .build();

    // Act
    ReadinessReport sizedByLevel = scorer.assess(TestStages.allStages().build());
    ReadinessReport sizedByKelly = scorer.assess(stages);

    // Assert
    assertThat(sizedByLevel.riskLevel()).isEqualTo(RiskLevel.LOW);
    assertThat(sizedByLevel.recommendedPositionSize()).isWithin(1e-9).of(0.03);
    assertThat(sizedByLevel.recommendedMaxExposure()).isWithin(1e-9).of(0.15);
    assertThat(sizedByKelly.recommendedPositionSize()).isWithin(1e-9).of(0.01);
  }

  @Test
  public void assess_deepWorstDrawdown_isHighRisk() {
    // Arrange
    StageResults stages =
        TestStages.allStages()
            .setMultiMarket(TestStages.multiMarket().setMaxDrawdown(0.4).build())
            .build();

    // Act
    ReadinessReport report = scorer.assess(stages);

    // Assert
    assertThat(report.riskLevel()).isEqualTo(RiskLevel.HIGH);
    assertThat(report.recommendedPositionSize()).isWithin(1e-9).of(0.01);
    assertThat(report.recommendedDailyLossLimit()).isWithin(1e-9).of(0.005);
  }

  @Test
  public void status_appliesScoreThresholds() {
    ImmutableList<String> none = ImmutableList.of();

    assertThat(ReadinessScorer.status(85, none, none)).isEqualTo(DeploymentStatus.APPROVED);
    assertThat(ReadinessScorer.status(84.9, none, none)).isEqualTo(DeploymentStatus.CONDITIONAL);
    assertThat(ReadinessScorer.status(90, none, ImmutableList.of("warning")))
        .isEqualTo(DeploymentStatus.CONDITIONAL);
    assertThat(ReadinessScorer.status(70, none, none)).isEqualTo(DeploymentStatus.CONDITIONAL);
    assertThat(ReadinessScorer.status(69.9, none, none))
        .isEqualTo(DeploymentStatus.NEEDS_IMPROVEMENT);
    assertThat(ReadinessScorer.status(99, ImmutableList.of("failure"), none))
        .isEqualTo(DeploymentStatus.REJECTED);
  }

  @Test
  public void render_listsStatusAndFailures() {
    // Arrange
    StageResults stages =
        TestStages.allStages()
            .setMultiMarket(TestStages.multiMarket().setMeanDrawdown(0.35).build())
            .build();

    // Act
    String text = scorer.assess(stages).render();

    // Assert
    assertThat(text).contains("Status: REJECTED");
    assertThat(text).contains("Critical failures:");
    assertThat(text).contains("Do not deploy to live trading");
  }
}
