package com.verlumen.strategylab.marketdata;

public enum TrendRegime {
  BULL,
  BEAR,
  SIDEWAYS
}
