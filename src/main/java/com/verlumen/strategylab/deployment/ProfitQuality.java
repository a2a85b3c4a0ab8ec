package com.verlumen.strategylab.deployment;

public enum ProfitQuality {
  EXCELLENT(85),
  GOOD(70),
  ACCEPTABLE(55),
  MARGINAL(40),
  POOR(0);

  private final double minScore;

  ProfitQuality(double minScore) {
    this.minScore = minScore;
  }

  static ProfitQuality forScore(double score) {
    for (ProfitQuality quality : values()) {
      if (score >= quality.minScore) {
        return quality;
      }
    }
    return POOR;
  }
}
