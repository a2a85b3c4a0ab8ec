package com.verlumen.strategylab.scoring;

/** Components of the composite fitness score. */
public enum Criterion {
  PNL("pnl", false),
  SHARPE_RATIO("sharpe_ratio", false),
  MAX_DRAWDOWN("max_drawdown", true),
  WIN_RATE("win_rate", false),
  CONSISTENCY("consistency", true),
  TRADE_FREQUENCY("trade_frequency", false),
  SLIPPAGE_RESISTANCE("slippage_resistance", true),
  EXECUTION_SPEED("execution_speed", true),
  MARKET_DIVERSITY("market_diversity", false);

  private final String key;
  private final boolean lowerIsBetter;

  Criterion(String key, boolean lowerIsBetter) {
    this.key = key;
    this.lowerIsBetter = lowerIsBetter;
  }

  /** Name used in profile files. */
  public String key() {
    return key;
  }

  /**
   * Whether the underlying raw metric improves as it decreases. Such metrics are inverted when
   * normalized, so every normalized criterion rewards higher values.
   */
  public boolean lowerIsBetter() {
    return lowerIsBetter;
  }

  public static Criterion fromKey(String key) {
    for (Criterion criterion : values()) {
      if (criterion.key.equals(key)) {
        return criterion;
      }
    }
    throw new IllegalArgumentException("Unknown criterion: " + key);
  }
}
