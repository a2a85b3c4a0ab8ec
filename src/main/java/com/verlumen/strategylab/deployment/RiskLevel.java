package com.verlumen.strategylab.deployment;

/** Risk class by worst observed drawdown, with the trading limits each class allows. */
public enum RiskLevel {
  LOW(0.15, 0.03, 0.15, 0.015),
  MEDIUM(0.30, 0.02, 0.10, 0.010),
  HIGH(0.50, 0.01, 0.05, 0.005),
  EXTREME(Double.POSITIVE_INFINITY, 0.005, 0.025, 0.002);

  private final double drawdownCeiling;
  private final double positionSize;
  private final double maxExposure;
  private final double dailyLossLimit;

  RiskLevel(
      double drawdownCeiling, double positionSize, double maxExposure, double dailyLossLimit) {
    this.drawdownCeiling = drawdownCeiling;
    this.positionSize = positionSize;
    this.maxExposure = maxExposure;
    this.dailyLossLimit = dailyLossLimit;
  }

  static RiskLevel forDrawdown(double maxDrawdown) {
    for (RiskLevel level : values()) {
      if (maxDrawdown < level.drawdownCeiling) {
        return level;
      }
    }
    return EXTREME;
  }

  /** Largest fraction of equity per trade. */
  public double positionSize() {
    return positionSize;
  }

  public double maxExposure() {
    return maxExposure;
  }

  public double dailyLossLimit() {
    return dailyLossLimit;
  }
}
