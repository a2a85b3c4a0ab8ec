package com.verlumen.strategylab.marketdata;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SyntheticMarketDataSourceTest {
  private static final MarketConfig MARKET = MarketUniverse.defaultMarkets().get(0);

  @Test
  public void fetch_sameSeed_isDeterministic() {
    // Arrange
    SyntheticMarketDataSource first = new SyntheticMarketDataSource(config(7L));
    SyntheticMarketDataSource second = new SyntheticMarketDataSource(config(7L));

    // Act & Assert
    assertThat(first.fetch(MARKET, 200)).isEqualTo(second.fetch(MARKET, 200));
  }

  @Test
  public void fetch_producesConsistentBars() {
    // Act
    ImmutableList<Candle> candles = new SyntheticMarketDataSource(config(1L)).fetch(MARKET, 500);

    // Assert
    assertThat(candles).hasSize(500);
    for (int i = 0; i < candles.size(); i++) {
      Candle candle = candles.get(i);
      assertThat(candle.high()).isAtLeast(Math.max(candle.open(), candle.close()));
      assertThat(candle.low()).isAtMost(Math.min(candle.open(), candle.close()));
      if (i > 0) {
        assertThat(candle.openTime()).isGreaterThan(candles.get(i - 1).openTime());
      }
    }
  }

  private static MarketDataConfig config(long seed) {
    return MarketDataConfig.create("spot", "futures", Duration.ofDays(1), Duration.ZERO, seed);
  }
}
