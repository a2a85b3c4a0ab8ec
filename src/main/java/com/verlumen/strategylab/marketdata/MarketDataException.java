package com.verlumen.strategylab.marketdata;

import java.io.IOException;

/** Candles for a market could not be fetched, or too few were available. */
public final class MarketDataException extends IOException {
  public MarketDataException(String message) {
    super(message);
  }

  public MarketDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
