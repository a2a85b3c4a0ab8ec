package com.verlumen.strategylab.marketdata;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.util.Locale;

/** One market a candidate can be evaluated on. Instances come from {@link MarketUniverse}. */
@AutoValue
public abstract class MarketConfig {
  static final int DEFAULT_LOOKBACK_DAYS = 30;
  static final int DEFAULT_MIN_DATA_POINTS = 1000;

  public static MarketConfig create(
      String symbol,
      Timeframe timeframe,
      MarketType marketType,
      VolatilityRegime volatilityRegime,
      TrendRegime trendRegime,
      int lookbackDays,
      int minDataPoints) {
    checkArgument(!symbol.isEmpty(), "Symbol cannot be empty");
    checkArgument(lookbackDays > 0, "Lookback must be positive");
    checkArgument(minDataPoints > 0, "Minimum data points must be positive");
    return new AutoValue_MarketConfig(
        symbol, timeframe, marketType, volatilityRegime, trendRegime, lookbackDays, minDataPoints);
  }

  public static MarketConfig create(
      String symbol,
      Timeframe timeframe,
      MarketType marketType,
      VolatilityRegime volatilityRegime,
      TrendRegime trendRegime,
      int lookbackDays) {
    return create(
        symbol,
        timeframe,
        marketType,
        volatilityRegime,
        trendRegime,
        lookbackDays,
        DEFAULT_MIN_DATA_POINTS);
  }

  public abstract String symbol();

  public abstract Timeframe timeframe();

  public abstract MarketType marketType();

  public abstract VolatilityRegime volatilityRegime();

  public abstract TrendRegime trendRegime();

  public abstract int lookbackDays();

  public abstract int minDataPoints();

  /** Key under which fetched candles are cached. */
  public String cacheKey() {
    return symbol() + "_" + timeframe().label() + "_" + typeLabel();
  }

  /** Number of bars to request from a source, bounded by what a single request can return. */
  public int requestLimit(int maxPerRequest) {
    return Math.max(1, Math.min(maxPerRequest, timeframe().barsIn(lookbackDays())));
  }

  public MarketConfig withMinDataPoints(int minDataPoints) {
    return create(
        symbol(),
        timeframe(),
        marketType(),
        volatilityRegime(),
        trendRegime(),
        lookbackDays(),
        minDataPoints);
  }

  @Override
  public final String toString() {
    return symbol() + " " + timeframe().label() + " " + typeLabel();
  }

  private String typeLabel() {
    return marketType().name().toLowerCase(Locale.ROOT);
  }
}
