package com.verlumen.strategylab.marketdata;

import java.time.Duration;

/** Bar durations understood by the market-data sources and the executor. */
public enum Timeframe {
  M1("1m", Duration.ofMinutes(1)),
  M5("5m", Duration.ofMinutes(5)),
  M15("15m", Duration.ofMinutes(15)),
  H1("1h", Duration.ofHours(1)),
  H4("4h", Duration.ofHours(4)),
  D1("1d", Duration.ofDays(1));

  private final String label;
  private final Duration duration;

  Timeframe(String label, Duration duration) {
    this.label = label;
    this.duration = duration;
  }

  public String label() {
    return label;
  }

  public Duration duration() {
    return duration;
  }

  /** Bars covering the given number of days. */
  public int barsIn(int days) {
    return (int) (Duration.ofDays(days).toMinutes() / duration.toMinutes());
  }

  public static Timeframe fromLabel(String label) {
    for (Timeframe timeframe : values()) {
      if (timeframe.label.equalsIgnoreCase(label)) {
        return timeframe;
      }
    }
    throw new IllegalArgumentException("Unknown timeframe: " + label);
  }

  @Override
  public String toString() {
    return label;
  }
}
