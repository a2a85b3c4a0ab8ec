package com.verlumen.strategylab.marketdata;

import com.google.common.collect.ImmutableList;

/**
 * TTL-bounded cache of candle series shared by concurrent evaluations.
 *
 * <p>A key is refreshed at most once per TTL window under normal operation. Concurrent misses on
 * the same key may both fetch; the later write wins.
 */
public interface MarketDataCache {
  /**
   * Returns candles for the market, fetching them when absent or stale.
   *
   * @throws MarketDataException if the fetch fails or yields fewer than the market's minimum
   *     number of data points
   */
  ImmutableList<Candle> get(MarketConfig market) throws MarketDataException;

  void invalidate(MarketConfig market);

  int size();
}
