package com.verlumen.strategylab.marketdata;

public enum VolatilityRegime {
  LOW,
  MEDIUM,
  HIGH,
  VERY_HIGH
}
