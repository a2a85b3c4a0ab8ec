package com.verlumen.strategylab.marketdata;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.time.Duration;

@AutoValue
public abstract class MarketDataConfig {
  public static final String DEFAULT_SPOT_URL = "https://api.binance.com/api/v3/klines";
  public static final String DEFAULT_FUTURES_URL = "https://fapi.binance.com/fapi/v1/klines";
  public static final Duration DEFAULT_CACHE_TTL = Duration.ofDays(7);

  public static MarketDataConfig create(
      String spotUrl,
      String futuresUrl,
      Duration cacheTtl,
      Duration requestTimeout,
      long syntheticSeed) {
    checkArgument(!cacheTtl.isNegative() && !cacheTtl.isZero(), "Cache TTL must be positive");
    checkArgument(!requestTimeout.isNegative(), "Request timeout cannot be negative");
    return new AutoValue_MarketDataConfig(
        spotUrl, futuresUrl, cacheTtl, requestTimeout, syntheticSeed);
  }

  public static MarketDataConfig defaults() {
    return create(
        DEFAULT_SPOT_URL, DEFAULT_FUTURES_URL, DEFAULT_CACHE_TTL, Duration.ofSeconds(30), 42L);
  }

  public abstract String spotUrl();

  public abstract String futuresUrl();

  public abstract Duration cacheTtl();

  public abstract Duration requestTimeout();

  /** Seed for the synthetic source used in dry runs. */
  public abstract long syntheticSeed();
}
