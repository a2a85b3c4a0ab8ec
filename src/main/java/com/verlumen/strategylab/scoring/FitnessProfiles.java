package com.verlumen.strategylab.scoring;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;

/**
 * Preset weightings, combined with a threshold tier by name, e.g. {@code BALANCED_DEMO} or {@code
 * LIVE_TRADING_PRODUCTION}.
 */
public final class FitnessProfiles {
  public static final String DEFAULT_PRESET = "BALANCED_DEMO";

  public static final ImmutableMap<Criterion, Double> CONSERVATIVE =
      weights(0.10, 0.22, 0.18, 0.14, 0.11, 0.04, 0.07, 0.03, 0.11);
  public static final ImmutableMap<Criterion, Double> BALANCED =
      weights(0.25, 0.20, 0.20, 0.15, 0.10, 0.03, 0.03, 0.02, 0.02);
  public static final ImmutableMap<Criterion, Double> AGGRESSIVE =
      weights(0.32, 0.14, 0.14, 0.10, 0.07, 0.11, 0.02, 0.03, 0.07);
  public static final ImmutableMap<Criterion, Double> LIVE_TRADING =
      weights(0.14, 0.17, 0.17, 0.13, 0.14, 0.01, 0.10, 0.07, 0.07);

  private static final ImmutableMap<String, ImmutableMap<Criterion, Double>> WEIGHT_PRESETS =
      ImmutableMap.of(
          "CONSERVATIVE", CONSERVATIVE,
          "BALANCED", BALANCED,
          "AGGRESSIVE", AGGRESSIVE,
          "LIVE_TRADING", LIVE_TRADING);

  /** Resolves {@code <WEIGHTS>_<TIER>}; a bare weight name uses the DEMO tier. */
  public static FitnessProfile fromPreset(String preset) {
    String name = preset.toUpperCase(Locale.ROOT);
    DeploymentThresholds thresholds = DeploymentThresholds.DEMO;
    String weightName = name;
    int split = name.lastIndexOf('_');
    if (split > 0 && isTier(name.substring(split + 1))) {
      weightName = name.substring(0, split);
      thresholds = DeploymentThresholds.fromName(name.substring(split + 1));
    }
    ImmutableMap<Criterion, Double> weights = WEIGHT_PRESETS.get(weightName);
    if (weights == null) {
      throw new IllegalArgumentException("Unknown fitness preset: " + preset);
    }
    return FitnessProfile.create(
        weightName + "_" + thresholds.name(), weights, thresholds, NormalizationRanges.DEFAULT);
  }

  public static FitnessProfile defaultProfile() {
    return fromPreset(DEFAULT_PRESET);
  }

  private static boolean isTier(String suffix) {
    return suffix.equals("DEMO") || suffix.equals("PRODUCTION");
  }

  private static ImmutableMap<Criterion, Double> weights(
      double pnl,
      double sharpe,
      double drawdown,
      double winRate,
      double consistency,
      double tradeFrequency,
      double slippage,
      double speed,
      double diversity) {
    return ImmutableMap.<Criterion, Double>builder()
        .put(Criterion.PNL, pnl)
        .put(Criterion.SHARPE_RATIO, sharpe)
        .put(Criterion.MAX_DRAWDOWN, drawdown)
        .put(Criterion.WIN_RATE, winRate)
        .put(Criterion.CONSISTENCY, consistency)
        .put(Criterion.TRADE_FREQUENCY, tradeFrequency)
        .put(Criterion.SLIPPAGE_RESISTANCE, slippage)
        .put(Criterion.EXECUTION_SPEED, speed)
        .put(Criterion.MARKET_DIVERSITY, diversity)
        .buildOrThrow();
  }

  private FitnessProfiles() {}
}
