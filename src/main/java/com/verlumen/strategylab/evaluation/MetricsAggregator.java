package com.verlumen.strategylab.evaluation;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableSortedSet.toImmutableSortedSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.Collection;
import java.util.Comparator;
import java.util.function.ToDoubleFunction;

/**
 * Order-independent reduction of per-market records.
 *
 * <p>Sharpe ratio, win rate and drawdown are averaged with weight {@code |pnl| + 0.01}. PnL and
 * trade counts are summed. Execution and consistency figures are plain means. Markets and
 * timeframes are unioned. Records are sorted before summing so floating-point results do not depend
 * on completion order.
 */
public final class MetricsAggregator {
  private static final double WEIGHT_FLOOR = 0.01;
  private static final Comparator<MetricsRecord> CANONICAL_ORDER =
      Comparator.comparing(MetricsRecord::market)
          .thenComparing(MetricsRecord::timeframe)
          .thenComparing(MetricsRecord::windowStart)
          .thenComparingDouble(MetricsRecord::pnl)
          .thenComparingDouble(MetricsRecord::sharpeRatio);

  public static AggregatedMetrics aggregate(Collection<MetricsRecord> records) {
    checkArgument(!records.isEmpty(), "Cannot aggregate an empty record set");
    ImmutableList<MetricsRecord> sorted =
        Ordering.from(CANONICAL_ORDER).immutableSortedCopy(records);

    double totalWeight = 0;
    for (MetricsRecord record : sorted) {
      totalWeight += weight(record);
    }

    return AggregatedMetrics.builder()
        .setTotalPnl(sum(sorted, MetricsRecord::pnl))
        .setNumTrades(sorted.stream().mapToInt(MetricsRecord::numTrades).sum())
        .setSharpeRatio(weighted(sorted, MetricsRecord::sharpeRatio, totalWeight))
        .setWinRate(weighted(sorted, MetricsRecord::winRate, totalWeight))
        .setMaxDrawdown(weighted(sorted, MetricsRecord::maxDrawdown, totalWeight))
        .setProfitFactor(mean(sorted, MetricsRecord::profitFactor))
        .setSlippage(mean(sorted, MetricsRecord::slippage))
        .setExecutionDelayMs(mean(sorted, MetricsRecord::executionDelayMs))
        .setMarketImpact(mean(sorted, MetricsRecord::marketImpact))
        .setVolatilityAdjustedReturn(mean(sorted, MetricsRecord::volatilityAdjustedReturn))
        .setDownsideDeviation(mean(sorted, MetricsRecord::downsideDeviation))
        .setMarketsTested(
            sorted.stream()
                .map(MetricsRecord::market)
                .collect(toImmutableSortedSet(Ordering.natural())))
        .setTimeframesTested(
            sorted.stream()
                .map(MetricsRecord::timeframe)
                .collect(toImmutableSortedSet(Ordering.natural())))
        .setRecordCount(sorted.size())
        .build();
  }

  private static double weight(MetricsRecord record) {
    return Math.abs(record.pnl()) + WEIGHT_FLOOR;
  }

  private static double weighted(
      ImmutableList<MetricsRecord> records,
      ToDoubleFunction<MetricsRecord> metric,
      double totalWeight) {
    double sum = 0;
    for (MetricsRecord record : records) {
      sum += metric.applyAsDouble(record) * weight(record);
    }
    return sum / totalWeight;
  }

  private static double sum(
      ImmutableList<MetricsRecord> records, ToDoubleFunction<MetricsRecord> metric) {
    double sum = 0;
    for (MetricsRecord record : records) {
      sum += metric.applyAsDouble(record);
    }
    return sum;
  }

  private static double mean(
      ImmutableList<MetricsRecord> records, ToDoubleFunction<MetricsRecord> metric) {
    return sum(records, metric) / records.size();
  }

  private MetricsAggregator() {}
}
