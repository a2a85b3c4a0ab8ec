package com.verlumen.strategylab.evaluation;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.strategylab.genome.Version;
import com.verlumen.strategylab.marketdata.Candle;
import com.verlumen.strategylab.marketdata.MarketConfig;
import com.verlumen.strategylab.marketdata.MarketType;
import com.verlumen.strategylab.marketdata.Timeframe;
import com.verlumen.strategylab.marketdata.TrendRegime;
import com.verlumen.strategylab.marketdata.VolatilityRegime;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class CandidateRunnerImplTest {
  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
  private static final MarketConfig MARKET =
      MarketConfig.create(
          "BTCUSDT",
          Timeframe.M5,
          MarketType.SPOT,
          VolatilityRegime.HIGH,
          TrendRegime.BULL,
          1,
          3);
  private static final Version VERSION =
      Version.builder()
          .setId("v-1")
          .setGenomeId("g-1")
          .setVersionNumber(1)
          .setParentVersionId(Optional.empty())
          .setCommitHash("abc")
          .setSource("\"\"\"@pyne\"\"\"\ndef main(): pass")
          .setParameters(ImmutableMap.of("level1", 9.0))
          .setCreatedAt(START)
          .build();

  @Rule public MockitoRule mocks = MockitoJUnit.rule();

  @Mock @Bind private BacktestExecutor mockExecutor;
  @Bind private final ExecutionCostModel costModel = new DefaultExecutionCostModel();
  @Bind private final EvaluatorConfig config = EvaluatorConfig.defaults();

  @Inject private CandidateRunnerImpl runner;

  private final ImmutableList<Candle> candles =
      ImmutableList.of(
          Candle.create(START, 100, 101, 99, 100, 10),
          Candle.create(START.plus(Duration.ofMinutes(5)), 100, 111, 99, 110, 10),
          Candle.create(START.plus(Duration.ofMinutes(10)), 110, 111, 98, 99, 10));

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void run_withOutput_computesRecordFromTrades() throws Exception {
    // Arrange
    when(mockExecutor.execute(any()))
        .thenAnswer(
            invocation -> {
              ExecutionRequest request = invocation.getArgument(0);
              Files.writeString(
                  request.outputDir().resolve("trades.json"),
                  "[{\"pnl\": 3.0, \"size\": 1}, {\"pnl\": -1.0, \"size\": 1}]");
              Files.writeString(
                  request.outputDir().resolve("equity.json"), "{\"equity\": [100, 103, 102]}");
              return ExecutionResult.create(0, request.outputDir(), "");
            });

    // Act
    BacktestOutcome outcome = runner.run(VERSION, MARKET, candles);

    // Assert
    MetricsRecord record = outcome.record();
    assertThat(record.market()).isEqualTo("BTCUSDT");
    assertThat(record.pnl()).isWithin(1e-9).of(2.0);
    assertThat(record.numTrades()).isEqualTo(2);
    assertThat(record.winRate()).isEqualTo(0.5);
    assertThat(record.profitFactor()).isWithin(1e-9).of(3.0);
    assertThat(record.maxDrawdown()).isWithin(1e-9).of(1.0 / 103);
    assertThat(record.estimated()).isFalse();
    assertThat(record.windowStart()).isEqualTo(START);
    assertThat(record.windowEnd()).isEqualTo(START.plus(Duration.ofMinutes(15)));
    assertThat(record.slippage()).isWithin(1e-12).of(costModel.slippage(MARKET));
    assertThat(outcome.tradePnls()).containsExactly(3.0, -1.0).inOrder();
  }

  @Test
  public void run_materializesSourceCandlesAndParameters() throws Exception {
    // Arrange
    AtomicReference<String> script = new AtomicReference<>();
    AtomicReference<String> data = new AtomicReference<>();
    AtomicReference<String> parameters = new AtomicReference<>();
    when(mockExecutor.execute(any()))
        .thenAnswer(
            invocation -> {
              ExecutionRequest request = invocation.getArgument(0);
              script.set(Files.readString(request.script(), StandardCharsets.UTF_8));
              data.set(Files.readString(request.data(), StandardCharsets.UTF_8));
              parameters.set(Files.readString(request.parameters(), StandardCharsets.UTF_8));
              return ExecutionResult.create(0, request.outputDir(), "");
            });

    // Act
    runner.run(VERSION, MARKET, candles);

    // Assert
    assertThat(script.get()).isEqualTo(VERSION.source());
    assertThat(data.get()).startsWith("time,open,high,low,close,volume\n");
    assertThat(data.get().lines().count()).isEqualTo(4);
    assertThat(parameters.get()).isEqualTo("{\"level1\":9.0}");
  }

  @Test
  public void run_withoutOutput_estimatesFromPrices() throws Exception {
    // Arrange
    when(mockExecutor.execute(any()))
        .thenAnswer(
            invocation -> {
              ExecutionRequest request = invocation.getArgument(0);
              return ExecutionResult.create(0, request.outputDir(), "");
            });

    // Act
    MetricsRecord record = runner.run(VERSION, MARKET, candles).record();

    // Assert
    assertThat(record.estimated()).isTrue();
    assertThat(record.numTrades()).isEqualTo(0);
    assertThat(record.maxDrawdown()).isEqualTo(0.1);
    assertThat(record.pnl()).isWithin(1e-9).of((0.1 + (99.0 / 110 - 1)) * 100);
  }

  @Test
  public void run_executorFails_throwsEvaluationException() throws Exception {
    // Arrange
    when(mockExecutor.execute(any())).thenThrow(new ExecutorException("exit code 2"));

    // Act
    EvaluationException thrown =
        assertThrows(EvaluationException.class, () -> runner.run(VERSION, MARKET, candles));

    // Assert
    assertThat(thrown).hasMessageThat().contains("exit code 2");
  }
}
