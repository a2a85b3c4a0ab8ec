package com.verlumen.strategylab.deployment;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.strategylab.evaluation.BacktestOutcome;
import com.verlumen.strategylab.evaluation.CandidateRunner;
import com.verlumen.strategylab.evaluation.ConcurrentEvaluator;
import com.verlumen.strategylab.evaluation.EvaluationException;
import com.verlumen.strategylab.evaluation.MarketFailure;
import com.verlumen.strategylab.evaluation.MarketRun;
import com.verlumen.strategylab.evaluation.TestRecords;
import com.verlumen.strategylab.genome.CandidateKey;
import com.verlumen.strategylab.genome.Version;
import com.verlumen.strategylab.marketdata.Candle;
import com.verlumen.strategylab.marketdata.MarketConfig;
import com.verlumen.strategylab.marketdata.MarketDataCache;
import com.verlumen.strategylab.marketdata.MarketDataException;
import com.verlumen.strategylab.marketdata.MarketUniverse;
import com.verlumen.strategylab.registry.CandidateRegistry;
import com.verlumen.strategylab.scoring.CompositeScorer;
import com.verlumen.strategylab.scoring.FitnessProfile;
import com.verlumen.strategylab.scoring.FitnessProfiles;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class DeploymentGateImplTest {
  private static final CandidateKey KEY = CandidateKey.create("g-1", "v-1");
  private static final Version VERSION =
      Version.builder()
          .setId("v-1")
          .setGenomeId("g-1")
          .setVersionNumber(1)
          .setParentVersionId(Optional.empty())
          .setCommitHash("abc")
          .setSource("\"\"\"@pyne\"\"\"\ndef main(): pass")
          .setParameters(ImmutableMap.of("level1", 9.0))
          .setCreatedAt(TestRecords.START)
          .build();
  private static final ImmutableList<MarketConfig> MATRIX = MarketUniverse.standardMatrix(30, 200);

  @Rule public MockitoRule mocks = MockitoJUnit.rule();

  @Mock @Bind private ConcurrentEvaluator mockEvaluator;
  @Mock @Bind private MarketDataCache mockMarketData;
  @Mock @Bind private CandidateRegistry mockRegistry;
  @Mock @Bind private CandidateRunner mockRunner;
  @Mock @Bind private CompositeScorer mockScorer;
  @Bind private final FitnessProfile profile = FitnessProfiles.defaultProfile();

  @Inject private DeploymentGate gate;

  @Before
  public void setUp() throws Exception {
    when(mockRegistry.version("v-1")).thenReturn(Optional.of(VERSION));
    when(mockScorer.score(any(), any())).thenReturn(0.8);
    when(mockEvaluator.defaultMarkets()).thenReturn(MATRIX.subList(0, 1));
    when(mockMarketData.get(any())).thenReturn(candles(1000));
    when(mockRunner.run(any(), any(), anyList()))
        .thenAnswer(
            invocation -> {
              List<Candle> slice = invocation.getArgument(2);
              return outcome(invocation.getArgument(1), slice.size() == 60 ? 14 : 20);
            });
    DeploymentConfig config =
        DeploymentConfig.create(
            ValidationChecklist.defaults(),
            WalkForwardConfig.defaults(),
            SimulationConfig.create(200, 0.95, 42L),
            30,
            200);
    Guice.createInjector(BoundFieldModule.of(this), DeploymentModule.create(config))
        .injectMembers(this);
  }

  @Test
  public void assess_strongCandidate_isApprovedAndMarkedReady() throws Exception {
    // Arrange
    ImmutableList.Builder<BacktestOutcome> outcomes = ImmutableList.builder();
    for (MarketConfig market : MATRIX.subList(0, 5)) {
      outcomes.add(outcome(market, 40));
    }
    when(mockEvaluator.evaluateMarkets(eq(KEY), anyList()))
        .thenReturn(MarketRun.create(outcomes.build(), ImmutableList.of()));

    // Act
    ReadinessReport report = gate.assess(KEY);

    // Assert
    assertThat(report.criticalFailures()).isEmpty();
    assertThat(report.warnings()).isEmpty();
    assertThat(report.status()).isEqualTo(DeploymentStatus.APPROVED);
    assertThat(report.riskLevel()).isEqualTo(RiskLevel.LOW);
    verify(mockRegistry).markReady(KEY, true);
  }

  @Test
  public void assess_everyMarketFails_isRejectedAndMarkedNotReady() throws Exception {
    // Arrange
    ImmutableList.Builder<MarketFailure> failures = ImmutableList.builder();
    for (MarketConfig market : MATRIX) {
      failures.add(MarketFailure.create(market.toString(), "no data"));
    }
    when(mockEvaluator.evaluateMarkets(eq(KEY), anyList()))
        .thenReturn(MarketRun.create(ImmutableList.of(), failures.build()));
    when(mockMarketData.get(any())).thenThrow(new MarketDataException("exchange offline"));

    // Act
    ReadinessReport report = gate.assess(KEY);

    // Assert
    assertThat(report.status()).isEqualTo(DeploymentStatus.REJECTED);
    assertThat(report.multiMarketScore()).isLessThan(50.0);
    assertThat(report.warnings()).contains("Profit analysis not performed");
    assertThat(report.warnings()).contains("Walk-forward validation not performed");
    assertThat(report.warnings()).contains("Robustness simulation not performed");
    verify(mockRegistry).markReady(KEY, false);
  }

  @Test
  public void assess_unknownVersion_throwsWithoutMarking() {
    // Arrange
    CandidateKey unknown = CandidateKey.create("g-1", "v-404");
    when(mockRegistry.version("v-404")).thenReturn(Optional.empty());

    // Act
    assertThrows(EvaluationException.class, () -> gate.assess(unknown));

    // Assert
    verify(mockRegistry, never()).markReady(any(), anyBoolean());
  }

  /** Equity that gains 1% and 0.5% on alternate bars; trades win three times in four. */
  private static BacktestOutcome outcome(MarketConfig market, int steps) {
    ImmutableList.Builder<Double> equity = ImmutableList.builder();
    double value = 1000;
    equity.add(value);
    for (int i = 0; i < steps; i++) {
      value *= i % 2 == 0 ? 1.01 : 1.005;
      equity.add(value);
    }
    return BacktestOutcome.create(
        market,
        TestRecords.record(market.symbol()).build(),
        equity.build(),
        ImmutableList.of(10.0, -5.0, 20.0, 15.0));
  }

  private static ImmutableList<Candle> candles(int count) {
    ImmutableList.Builder<Candle> candles = ImmutableList.builder();
    for (int i = 0; i < count; i++) {
      double price = 100 + Math.sin(i / 10.0);
      candles.add(
          Candle.create(
              TestRecords.START.plus(Duration.ofHours(i)), price, price + 1, price - 1, price, 5));
    }
    return candles.build();
  }
}
