package com.verlumen.strategylab.marketdata;

import com.google.common.collect.ImmutableList;

/** Retrieves historical candles, oldest first. */
public interface MarketDataSource {
  ImmutableList<Candle> fetch(MarketConfig market, int limit) throws MarketDataException;
}
