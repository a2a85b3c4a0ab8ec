package com.verlumen.strategylab.marketdata;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;

/** The static set of markets candidates are drawn against. */
public final class MarketUniverse {
  public static final ImmutableList<String> STANDARD_SYMBOLS =
      ImmutableList.of("BTCUSDT", "ETHUSDT", "SOLUSDT", "ADAUSDT", "BNBUSDT");

  public static final ImmutableList<Timeframe> STANDARD_TIMEFRAMES =
      ImmutableList.of(Timeframe.M5, Timeframe.M15, Timeframe.H1);

  private static final ImmutableList<MarketConfig> DEFAULT_MARKETS =
      ImmutableList.of(
          // Majors
          market("BTCUSDT", Timeframe.M1, MarketType.SPOT, VolatilityRegime.HIGH, 30),
          market("BTCUSDT", Timeframe.M5, MarketType.SPOT, VolatilityRegime.HIGH, 14),
          market("BTCUSDT", Timeframe.M15, MarketType.SPOT, VolatilityRegime.HIGH, 7),
          market("ETHUSDT", Timeframe.M1, MarketType.SPOT, VolatilityRegime.HIGH, 30),
          market("ETHUSDT", Timeframe.M5, MarketType.SPOT, VolatilityRegime.HIGH, 14),
          // Medium volatility altcoins
          market("ADAUSDT", Timeframe.M1, MarketType.SPOT, VolatilityRegime.MEDIUM, 21),
          market("SOLUSDT", Timeframe.M5, MarketType.SPOT, VolatilityRegime.MEDIUM, 14),
          market("MATICUSDT", Timeframe.M15, MarketType.SPOT, VolatilityRegime.MEDIUM, 10),
          // Thin books, violent moves
          market("DOGEUSDT", Timeframe.M1, MarketType.SPOT, VolatilityRegime.HIGH, 21),
          market("SHIBUSDT", Timeframe.M5, MarketType.SPOT, VolatilityRegime.VERY_HIGH, 14),
          market("BTCUSDT", Timeframe.M1, MarketType.FUTURES, VolatilityRegime.HIGH, 30),
          // Commodity and forex proxies
          market("XAUUSDT", Timeframe.M1, MarketType.SPOT, VolatilityRegime.MEDIUM, 21),
          MarketConfig.create(
              "EURUSDT",
              Timeframe.M15,
              MarketType.SPOT,
              VolatilityRegime.LOW,
              TrendRegime.SIDEWAYS,
              14));

  public static ImmutableList<MarketConfig> defaultMarkets() {
    return DEFAULT_MARKETS;
  }

  /** Every standard symbol on every standard timeframe. */
  public static ImmutableList<MarketConfig> standardMatrix(int lookbackDays, int minDataPoints) {
    return STANDARD_SYMBOLS.stream()
        .flatMap(
            symbol ->
                STANDARD_TIMEFRAMES.stream()
                    .map(
                        timeframe ->
                            MarketConfig.create(
                                symbol,
                                timeframe,
                                MarketType.SPOT,
                                VolatilityRegime.MEDIUM,
                                TrendRegime.SIDEWAYS,
                                lookbackDays,
                                minDataPoints)))
        .collect(toImmutableList());
  }

  private static MarketConfig market(
      String symbol,
      Timeframe timeframe,
      MarketType type,
      VolatilityRegime volatility,
      int lookbackDays) {
    return MarketConfig.create(symbol, timeframe, type, volatility, TrendRegime.BULL, lookbackDays);
  }

  private MarketUniverse() {}
}
