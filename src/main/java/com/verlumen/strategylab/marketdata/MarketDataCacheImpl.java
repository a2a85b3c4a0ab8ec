package com.verlumen.strategylab.marketdata;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.primitives.Ints;
import com.google.inject.Inject;

final class MarketDataCacheImpl implements MarketDataCache {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final MarketDataSource source;
  private final Cache<String, ImmutableList<Candle>> entries;

  @Inject
  MarketDataCacheImpl(MarketDataSource source, Ticker ticker, MarketDataConfig config) {
    this.source = source;
    this.entries =
        CacheBuilder.newBuilder().expireAfterWrite(config.cacheTtl()).ticker(ticker).build();
  }

  @Override
  public ImmutableList<Candle> get(MarketConfig market) throws MarketDataException {
    String key = market.cacheKey();
    // No loader: concurrent misses each fetch and the last put wins.
    ImmutableList<Candle> candles = entries.getIfPresent(key);
    if (candles == null) {
      logger.atFine().log("Cache miss for %s, fetching", key);
      int limit =
          Math.max(market.minDataPoints(), market.timeframe().barsIn(market.lookbackDays()));
      candles = source.fetch(market, limit);
      entries.put(key, candles);
    }

    if (candles.size() < market.minDataPoints()) {
      throw new MarketDataException(
          String.format(
              "Insufficient data for %s: %d candles, need %d",
              market, candles.size(), market.minDataPoints()));
    }
    return candles;
  }

  @Override
  public void invalidate(MarketConfig market) {
    entries.invalidate(market.cacheKey());
  }

  @Override
  public int size() {
    entries.cleanUp();
    return Ints.saturatedCast(entries.size());
  }
}
