package com.verlumen.strategylab.evaluation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.strategylab.marketdata.MarketConfig;
import com.verlumen.strategylab.marketdata.Timeframe;
import com.verlumen.strategylab.marketdata.VolatilityRegime;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Picks a small market subset that still spans volatility regimes and timeframes. */
public final class MarketSampler {
  public static final int DEFAULT_CAP = 8;
  private static final int PER_VOLATILITY_BUCKET = 2;

  /**
   * Two high-volatility markets (HIGH or VERY_HIGH), two medium ones, then the first market of
   * every timeframe not yet covered, in universe order and truncated to {@code cap}.
   */
  public static ImmutableList<MarketConfig> diverseSubset(List<MarketConfig> universe, int cap) {
    checkArgument(cap > 0, "Cap must be positive");
    Set<MarketConfig> selected = new LinkedHashSet<>();
    universe.stream()
        .filter(market -> isHigh(market.volatilityRegime()))
        .limit(PER_VOLATILITY_BUCKET)
        .forEach(selected::add);
    universe.stream()
        .filter(market -> market.volatilityRegime() == VolatilityRegime.MEDIUM)
        .limit(PER_VOLATILITY_BUCKET)
        .forEach(selected::add);

    Set<Timeframe> covered = EnumSet.noneOf(Timeframe.class);
    selected.forEach(market -> covered.add(market.timeframe()));
    for (MarketConfig market : universe) {
      if (covered.add(market.timeframe())) {
        selected.add(market);
      }
    }
    return selected.stream().limit(cap).collect(ImmutableList.toImmutableList());
  }

  private static boolean isHigh(VolatilityRegime regime) {
    return regime == VolatilityRegime.HIGH || regime == VolatilityRegime.VERY_HIGH;
  }

  private MarketSampler() {}
}
