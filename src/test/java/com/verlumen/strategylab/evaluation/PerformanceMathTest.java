package com.verlumen.strategylab.evaluation;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PerformanceMathTest {
  @Test
  public void returns_skipsZeroBase() {
    assertThat(PerformanceMath.returns(ImmutableList.of(100.0, 150.0, 0.0, 5.0)))
        .containsExactly(0.5, -1.0)
        .inOrder();
  }

  @Test
  public void sharpeRatio_constantReturns_isZero() {
    assertThat(PerformanceMath.sharpeRatio(ImmutableList.of(0.5, 0.5, 0.5))).isEqualTo(0.0);
  }

  @Test
  public void sharpeRatio_singleReturn_isZero() {
    assertThat(PerformanceMath.sharpeRatio(ImmutableList.of(0.05))).isEqualTo(0.0);
  }

  @Test
  public void sharpeRatio_annualizesExcessReturn() {
    // Arrange
    ImmutableList<Double> returns = ImmutableList.of(0.01, 0.03);
    double std = Math.sqrt(0.0002); // sample deviation of {0.01, 0.03}
    double expected = (0.02 - 0.02 / 252) / std * Math.sqrt(252);

    // Act & Assert
    assertThat(PerformanceMath.sharpeRatio(returns)).isWithin(1e-9).of(expected);
  }

  @Test
  public void maxDrawdown_measuresDeepestFallFromPeak() {
    assertThat(PerformanceMath.maxDrawdown(ImmutableList.of(100.0, 120.0, 90.0, 130.0, 117.0)))
        .isWithin(1e-9)
        .of(30.0 / 130.0);
  }

  @Test
  public void maxDrawdown_emptyCurve_isZero() {
    assertThat(PerformanceMath.maxDrawdown(ImmutableList.of())).isEqualTo(0.0);
  }

  @Test
  public void profitFactor_needsWinsAndLosses() {
    assertThat(PerformanceMath.profitFactor(ImmutableList.of(3.0, -1.0, 1.0))).isEqualTo(4.0);
    assertThat(PerformanceMath.profitFactor(ImmutableList.of(3.0, 1.0))).isEqualTo(1.0);
  }

  @Test
  public void winRate_countsPositiveTrades() {
    assertThat(PerformanceMath.winRate(ImmutableList.of(1.0, -1.0, 0.0, 2.0))).isEqualTo(0.5);
    assertThat(PerformanceMath.winRate(ImmutableList.of())).isEqualTo(0.0);
  }
}
