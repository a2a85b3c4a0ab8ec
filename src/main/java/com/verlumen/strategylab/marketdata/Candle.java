package com.verlumen.strategylab.marketdata;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.time.Instant;

/** One OHLCV bar. */
@AutoValue
public abstract class Candle {
  public static Candle create(
      Instant openTime, double open, double high, double low, double close, double volume) {
    checkArgument(high >= low, "High %s is below low %s", high, low);
    checkArgument(volume >= 0, "Volume cannot be negative");
    return new AutoValue_Candle(openTime, open, high, low, close, volume);
  }

  public abstract Instant openTime();

  public abstract double open();

  public abstract double high();

  public abstract double low();

  public abstract double close();

  public abstract double volume();
}
