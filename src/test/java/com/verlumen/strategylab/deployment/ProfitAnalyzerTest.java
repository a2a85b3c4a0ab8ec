package com.verlumen.strategylab.deployment;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ProfitAnalyzerTest {
  private final ProfitAnalyzer analyzer = new ProfitAnalyzer();

  @Test
  public void compound_startsAtOne() {
    ImmutableList<Double> equity = ProfitAnalyzer.compound(ImmutableList.of(0.1, -0.1));

    assertThat(equity).hasSize(3);
    assertThat(equity.get(0)).isEqualTo(1.0);
    assertThat(equity.get(1)).isWithin(1e-12).of(1.1);
    assertThat(equity.get(2)).isWithin(1e-12).of(0.99);
  }

  @Test
  public void analyze_steadyPositiveReturns_areSignificant() {
    // Arrange
    List<Double> returns = alternating(0.02, 0.03, 40);

    // Act
    ProfitMetrics metrics = analyzer.analyze(returns, ImmutableList.of());

    // Assert
    assertThat(metrics.periods()).isEqualTo(40);
    assertThat(metrics.totalReturn()).isGreaterThan(1.0);
    assertThat(metrics.statisticallySignificant()).isTrue();
    assertThat(metrics.testPValue()).isLessThan(0.05);
    assertThat(metrics.returnCiLower()).isLessThan(metrics.returnCiUpper());
    assertThat(metrics.tradeAnalysis().isPresent()).isFalse();
    assertThat(metrics.qualityScore()).isAtLeast(70.0);
  }

  @Test
  public void analyze_constantReturns_areNotTestable() {
    // Act
    ProfitMetrics metrics = analyzer.analyze(Collections.nCopies(10, 0.01), ImmutableList.of());

    // Assert
    assertThat(metrics.testStatistic()).isEqualTo(0.0);
    assertThat(metrics.testPValue()).isEqualTo(1.0);
    assertThat(metrics.statisticallySignificant()).isFalse();
    assertThat(metrics.totalReturn()).isWithin(1e-9).of(Math.pow(1.01, 10) - 1);
  }

  @Test
  public void analyze_noReturns_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> analyzer.analyze(ImmutableList.of(), ImmutableList.of(1.0)));
  }

  @Test
  public void analyzeTrades_computesWinLossStatistics() {
    // Act
    TradeAnalysis trades = analyzer.analyzeTrades(ImmutableList.of(10.0, -5.0, 20.0, -5.0, 15.0));

    // Assert
    assertThat(trades.totalTrades()).isEqualTo(5);
    assertThat(trades.winningTrades()).isEqualTo(3);
    assertThat(trades.losingTrades()).isEqualTo(2);
    assertThat(trades.winRate()).isWithin(1e-9).of(0.6);
    assertThat(trades.profitFactor()).isWithin(1e-9).of(4.5);
    assertThat(trades.avgWin()).isWithin(1e-9).of(15.0);
    assertThat(trades.avgLoss()).isWithin(1e-9).of(5.0);
    assertThat(trades.riskRewardRatio()).isWithin(1e-9).of(3.0);
    assertThat(trades.expectancy()).isWithin(1e-9).of(7.0);
    assertThat(trades.maxConsecutiveWins()).isEqualTo(1);
    assertThat(trades.largestLoss()).isEqualTo(-5.0);
  }

  @Test
  public void analyzeTrades_capsKellyFraction() {
    TradeAnalysis trades = analyzer.analyzeTrades(ImmutableList.of(10.0, -5.0, 20.0, -5.0, 15.0));

    assertThat(trades.kellyFraction()).isEqualTo(0.25);
  }

  @Test
  public void analyzeTrades_losingEdge_hasZeroKelly() {
    TradeAnalysis trades = analyzer.analyzeTrades(ImmutableList.of(1.0, -5.0, -5.0, 1.0));

    assertThat(trades.kellyFraction()).isEqualTo(0.0);
    assertThat(trades.maxConsecutiveLosses()).isEqualTo(2);
  }

  @Test
  public void qualityScore_topBandsEverywhere_isHundred() {
    assertThat(ProfitAnalyzer.qualityScore(1.5, 2.5, 3.0, 4.0, 0.7, true)).isEqualTo(100.0);
  }

  @Test
  public void qualityScore_flatPerformance_isZero() {
    assertThat(ProfitAnalyzer.qualityScore(0.0, 0.0, 0.0, 0.0, 0.0, false)).isEqualTo(0.0);
  }

  private static List<Double> alternating(double first, double second, int count) {
    List<Double> returns = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      returns.add(i % 2 == 0 ? first : second);
    }
    return returns;
  }
}
