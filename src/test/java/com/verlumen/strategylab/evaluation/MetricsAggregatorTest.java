package com.verlumen.strategylab.evaluation;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.verlumen.strategylab.marketdata.Timeframe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MetricsAggregatorTest {
  @Test
  public void aggregate_sumsPnlAndTrades() {
    // Arrange
    ImmutableList<MetricsRecord> records =
        ImmutableList.of(
            TestRecords.record("BTCUSDT", 10.0),
            TestRecords.record("ETHUSDT", -4.0),
            TestRecords.record("SOLUSDT").setPnl(6.0).setNumTrades(5).build());

    // Act
    AggregatedMetrics metrics = MetricsAggregator.aggregate(records);

    // Assert
    assertThat(metrics.totalPnl()).isWithin(1e-9).of(12.0);
    assertThat(metrics.numTrades()).isEqualTo(25);
    assertThat(metrics.recordCount()).isEqualTo(3);
  }

  @Test
  public void aggregate_weightsRateMetricsByAbsolutePnl() {
    // Arrange
    MetricsRecord big = TestRecords.record("BTCUSDT").setPnl(99.99).setSharpeRatio(3.0).build();
    MetricsRecord flat = TestRecords.record("ETHUSDT").setPnl(0.0).setSharpeRatio(-1.0).build();

    // Act
    AggregatedMetrics metrics = MetricsAggregator.aggregate(ImmutableList.of(big, flat));

    // Assert
    // Weights are 100 and 0.01.
    double expected = (3.0 * 100 - 1.0 * 0.01) / 100.01;
    assertThat(metrics.sharpeRatio()).isWithin(1e-9).of(expected);
  }

  @Test
  public void aggregate_averagesExecutionFigures() {
    // Arrange
    ImmutableList<MetricsRecord> records =
        ImmutableList.of(
            TestRecords.record("BTCUSDT").setExecutionDelayMs(40).setSlippage(0.001).build(),
            TestRecords.record("ETHUSDT").setExecutionDelayMs(80).setSlippage(0.003).build());

    // Act
    AggregatedMetrics metrics = MetricsAggregator.aggregate(records);

    // Assert
    assertThat(metrics.executionDelayMs()).isWithin(1e-9).of(60.0);
    assertThat(metrics.slippage()).isWithin(1e-12).of(0.002);
  }

  @Test
  public void aggregate_unionsMarketsAndTimeframes() {
    // Arrange
    ImmutableList<MetricsRecord> records =
        ImmutableList.of(
            TestRecords.record("ETHUSDT").setTimeframe(Timeframe.H1).build(),
            TestRecords.record("BTCUSDT").setTimeframe(Timeframe.M5).build(),
            TestRecords.record("BTCUSDT").setTimeframe(Timeframe.H1).build());

    // Act
    AggregatedMetrics metrics = MetricsAggregator.aggregate(records);

    // Assert
    assertThat(metrics.marketsTested()).containsExactly("BTCUSDT", "ETHUSDT").inOrder();
    assertThat(metrics.timeframesTested()).containsExactly(Timeframe.M5, Timeframe.H1).inOrder();
  }

  @Test
  public void aggregate_isIndependentOfOrder() {
    // Arrange
    List<MetricsRecord> records = new ArrayList<>();
    Random random = new Random(5);
    for (int i = 0; i < 12; i++) {
      records.add(
          TestRecords.record("M" + i)
              .setPnl(random.nextGaussian() * 50)
              .setSharpeRatio(random.nextGaussian())
              .setWinRate(random.nextDouble())
              .setMaxDrawdown(random.nextDouble())
              .build());
    }
    AggregatedMetrics expected = MetricsAggregator.aggregate(records);

    for (int shuffle = 0; shuffle < 10; shuffle++) {
      Collections.shuffle(records, random);

      // Act
      AggregatedMetrics actual = MetricsAggregator.aggregate(records);

      // Assert
      assertThat(actual).isEqualTo(expected);
    }
  }

  @Test
  public void aggregate_emptyRecords_throws() {
    assertThrows(
        IllegalArgumentException.class, () -> MetricsAggregator.aggregate(ImmutableList.of()));
  }
}
