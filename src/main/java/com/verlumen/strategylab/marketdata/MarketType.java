package com.verlumen.strategylab.marketdata;

public enum MarketType {
  SPOT,
  FUTURES
}
