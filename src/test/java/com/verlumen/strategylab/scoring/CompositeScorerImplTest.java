package com.verlumen.strategylab.scoring;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.strategylab.evaluation.AggregatedMetrics;
import com.verlumen.strategylab.evaluation.MetricsAggregator;
import com.verlumen.strategylab.evaluation.MetricsRecord;
import com.verlumen.strategylab.evaluation.TestRecords;
import java.util.Arrays;
import java.util.function.BiFunction;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CompositeScorerImplTest {
  private static final FitnessProfile PROFILE = FitnessProfiles.fromPreset("BALANCED_DEMO");

  @Inject private CompositeScorerImpl scorer;

  @Before
  public void setUp() {
    Guice.createInjector().injectMembers(this);
  }

  @Test
  public void score_isWithinUnitInterval() {
    // Arrange
    AggregatedMetrics strong =
        aggregate(
            TestRecords.record("A").setPnl(5000).setSharpeRatio(10).setMaxDrawdown(0).build());
    AggregatedMetrics weak =
        aggregate(
            TestRecords.record("A")
                .setPnl(-50)
                .setSharpeRatio(-3)
                .setMaxDrawdown(1)
                .setWinRate(0)
                .setNumTrades(0)
                .build());

    // Act & Assert
    assertThat(scorer.score(strong, PROFILE)).isAtMost(1.0);
    assertThat(scorer.score(weak, PROFILE)).isAtLeast(0.0);
  }

  @Test
  public void score_isMonotonicInHigherIsBetterMetrics() {
    assertIncreasing((b, v) -> b.setPnl(v), 0, 100, 500, 900);
    assertIncreasing((b, v) -> b.setSharpeRatio(v), 0, 0.5, 1.5, 2.9);
    assertIncreasing((b, v) -> b.setWinRate(v), 0.1, 0.3, 0.6, 0.9);
    assertIncreasing((b, v) -> b.setVolatilityAdjustedReturn(v), 0.3, 0.5, 1.0, 1.5);
    assertIncreasing((b, v) -> b.setNumTrades(v.intValue()), 1, 10, 20, 40);
  }

  @Test
  public void score_isMonotonicDecreasingInCosts() {
    assertIncreasing((b, v) -> b.setMaxDrawdown(0.3 - v), 0, 0.05, 0.1, 0.2);
    assertIncreasing((b, v) -> b.setSlippage(0.04 - v), 0, 0.01, 0.02, 0.03);
    assertIncreasing((b, v) -> b.setExecutionDelayMs(900 - v), 0, 200, 400, 800);
  }

  @Test
  public void normalize_marketDiversity_growsWithDistinctMarkets() {
    AggregatedMetrics one = aggregate(TestRecords.record("A", 1));
    AggregatedMetrics three =
        aggregate(
            TestRecords.record("A", 1), TestRecords.record("B", 1), TestRecords.record("C", 1));

    assertThat(scorer.normalize(Criterion.MARKET_DIVERSITY, one, PROFILE)).isWithin(1e-9).of(0.2);
    assertThat(scorer.normalize(Criterion.MARKET_DIVERSITY, three, PROFILE))
        .isWithin(1e-9)
        .of(0.6);
  }

  @Test
  public void normalize_drawdownBeyondThreshold_isZero() {
    AggregatedMetrics metrics = aggregate(TestRecords.record("A").setMaxDrawdown(0.5).build());

    assertThat(scorer.normalize(Criterion.MAX_DRAWDOWN, metrics, PROFILE)).isEqualTo(0.0);
  }

  @Test
  public void normalize_lowerIsBetterCriteria_scoreFullMarksAtZeroCost() {
    // Arrange
    AggregatedMetrics costless =
        aggregate(
            TestRecords.record("A")
                .setMaxDrawdown(0)
                .setSlippage(0)
                .setExecutionDelayMs(0)
                .setDownsideDeviation(0)
                .build());
    ImmutableList<Criterion> inverted =
        Arrays.stream(Criterion.values())
            .filter(Criterion::lowerIsBetter)
            .collect(ImmutableList.toImmutableList());

    // Act & Assert
    assertThat(inverted)
        .containsExactly(
            Criterion.MAX_DRAWDOWN,
            Criterion.CONSISTENCY,
            Criterion.SLIPPAGE_RESISTANCE,
            Criterion.EXECUTION_SPEED);
    for (Criterion criterion : inverted) {
      assertThat(scorer.normalize(criterion, costless, PROFILE)).isWithin(1e-9).of(1.0);
    }
  }

  @Test
  public void isDeploymentReady_allThresholdsMet_isReady() {
    AggregatedMetrics metrics =
        aggregate(
            TestRecords.record("A", 10), TestRecords.record("B", 10), TestRecords.record("C", 10));

    DeploymentVerdict verdict = scorer.isDeploymentReady(0.5, metrics, PROFILE);

    assertThat(verdict.ready()).isTrue();
    assertThat(verdict.reasons()).isEmpty();
  }

  @Test
  public void isDeploymentReady_hardThresholdFails_overridesHighScore() {
    // Arrange: only one market, below the DEMO minimum of two.
    AggregatedMetrics metrics = aggregate(TestRecords.record("A").setNumTrades(30).build());

    // Act
    DeploymentVerdict verdict = scorer.isDeploymentReady(0.99, metrics, PROFILE);

    // Assert
    assertThat(verdict.ready()).isFalse();
    assertThat(verdict.reasons()).containsExactly("Insufficient market testing: 1 markets");
  }

  @Test
  public void isDeploymentReady_reportsEveryFailedThreshold() {
    AggregatedMetrics metrics =
        aggregate(
            TestRecords.record("A")
                .setSharpeRatio(0.1)
                .setWinRate(0.2)
                .setMaxDrawdown(0.5)
                .setNumTrades(1)
                .setSlippage(0.1)
                .setExecutionDelayMs(5000)
                .setMarketImpact(0.2)
                .build());

    DeploymentVerdict verdict = scorer.isDeploymentReady(0.1, metrics, PROFILE);

    assertThat(verdict.reasons()).hasSize(10);
  }

  private void assertIncreasing(
      BiFunction<MetricsRecord.Builder, Double, MetricsRecord.Builder> setter, double... values) {
    double previous = -1;
    for (double value : values) {
      MetricsRecord record = setter.apply(TestRecords.record("A"), value).build();
      double score = scorer.score(aggregate(record), PROFILE);
      assertThat(score).isGreaterThan(previous);
      previous = score;
    }
  }

  private static AggregatedMetrics aggregate(MetricsRecord... records) {
    return MetricsAggregator.aggregate(ImmutableList.copyOf(records));
  }
}
