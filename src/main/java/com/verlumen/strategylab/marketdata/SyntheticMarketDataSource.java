package com.verlumen.strategylab.marketdata;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import java.time.Instant;
import java.util.Random;

/**
 * Deterministic random-walk candles for dry runs. The same market and seed always produce the same
 * series.
 */
final class SyntheticMarketDataSource implements MarketDataSource {
  private static final Instant END = Instant.parse("2024-01-01T00:00:00Z");
  private static final double START_PRICE = 100.0;

  private final long seed;

  @Inject
  SyntheticMarketDataSource(MarketDataConfig config) {
    this.seed = config.syntheticSeed();
  }

  @Override
  public ImmutableList<Candle> fetch(MarketConfig market, int limit) {
    Random random = new Random(seed ^ market.cacheKey().hashCode());
    double volatility = volatility(market.volatilityRegime());
    double drift = drift(market.trendRegime());
    Instant time = END.minus(market.timeframe().duration().multipliedBy(limit));

    ImmutableList.Builder<Candle> candles = ImmutableList.builder();
    double price = START_PRICE;
    for (int i = 0; i < limit; i++) {
      double open = price;
      double close = Math.max(0.01, open * (1 + drift + volatility * random.nextGaussian()));
      double wick = Math.abs(random.nextGaussian()) * volatility * open / 2;
      double high = Math.max(open, close) + wick;
      double low = Math.max(0.005, Math.min(open, close) - wick);
      double volume = 1000 * (1 + random.nextDouble());
      candles.add(Candle.create(time, open, high, low, close, volume));
      time = time.plus(market.timeframe().duration());
      price = close;
    }
    return candles.build();
  }

  private static double volatility(VolatilityRegime regime) {
    switch (regime) {
      case LOW:
        return 0.001;
      case MEDIUM:
        return 0.003;
      case HIGH:
        return 0.006;
      case VERY_HIGH:
        return 0.01;
    }
    throw new AssertionError(regime);
  }

  private static double drift(TrendRegime trend) {
    switch (trend) {
      case BULL:
        return 0.0002;
      case BEAR:
        return -0.0002;
      case SIDEWAYS:
        return 0.0;
    }
    throw new AssertionError(trend);
  }
}
