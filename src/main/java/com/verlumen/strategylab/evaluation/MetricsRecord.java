package com.verlumen.strategylab.evaluation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.verlumen.strategylab.marketdata.Timeframe;
import java.time.Instant;

/**
 * Result of running one candidate version against one market.
 *
 * <p>Values are validated once at construction and carried by value afterwards. {@code pnl} is the
 * sum of trade returns in percent. Drawdown and win rate are fractions in [0, 1]; slippage and
 * market impact are fractions of price; execution delay is in milliseconds.
 */
@AutoValue
public abstract class MetricsRecord {
  public abstract String market();

  public abstract Timeframe timeframe();

  public abstract Instant windowStart();

  public abstract Instant windowEnd();

  public abstract double pnl();

  public abstract double sharpeRatio();

  public abstract double maxDrawdown();

  public abstract double winRate();

  public abstract double profitFactor();

  public abstract int numTrades();

  public abstract double slippage();

  public abstract double executionDelayMs();

  public abstract double marketImpact();

  public abstract double volatilityAdjustedReturn();

  public abstract double downsideDeviation();

  /** True when the executor produced no output and the values were derived from prices alone. */
  public abstract boolean estimated();

  public double avgTradePnl() {
    return numTrades() == 0 ? 0.0 : pnl() / numTrades();
  }

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_MetricsRecord.Builder()
        .setProfitFactor(1.0)
        .setSlippage(0.0)
        .setExecutionDelayMs(0.0)
        .setMarketImpact(0.0)
        .setVolatilityAdjustedReturn(0.0)
        .setDownsideDeviation(0.0)
        .setEstimated(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMarket(String market);

    public abstract Builder setTimeframe(Timeframe timeframe);

    public abstract Builder setWindowStart(Instant windowStart);

    public abstract Builder setWindowEnd(Instant windowEnd);

    public abstract Builder setPnl(double pnl);

    public abstract Builder setSharpeRatio(double sharpeRatio);

    public abstract Builder setMaxDrawdown(double maxDrawdown);

    public abstract Builder setWinRate(double winRate);

    public abstract Builder setProfitFactor(double profitFactor);

    public abstract Builder setNumTrades(int numTrades);

    public abstract Builder setSlippage(double slippage);

    public abstract Builder setExecutionDelayMs(double executionDelayMs);

    public abstract Builder setMarketImpact(double marketImpact);

    public abstract Builder setVolatilityAdjustedReturn(double volatilityAdjustedReturn);

    public abstract Builder setDownsideDeviation(double downsideDeviation);

    public abstract Builder setEstimated(boolean estimated);

    abstract MetricsRecord autoBuild();

    public MetricsRecord build() {
      MetricsRecord record = autoBuild();
      checkArgument(!record.market().isEmpty(), "Market cannot be empty");
      checkArgument(
          !record.windowEnd().isBefore(record.windowStart()), "Window ends before it starts");
      checkFinite("pnl", record.pnl());
      checkFinite("sharpeRatio", record.sharpeRatio());
      checkFinite("profitFactor", record.profitFactor());
      checkFinite("volatilityAdjustedReturn", record.volatilityAdjustedReturn());
      checkFraction("maxDrawdown", record.maxDrawdown());
      checkFraction("winRate", record.winRate());
      checkArgument(record.numTrades() >= 0, "Trade count cannot be negative");
      checkArgument(record.slippage() >= 0, "Slippage cannot be negative");
      checkArgument(record.executionDelayMs() >= 0, "Execution delay cannot be negative");
      checkArgument(record.marketImpact() >= 0, "Market impact cannot be negative");
      checkArgument(record.downsideDeviation() >= 0, "Downside deviation cannot be negative");
      return record;
    }

    private static void checkFinite(String name, double value) {
      checkArgument(Double.isFinite(value), "%s must be finite, was %s", name, value);
    }

    private static void checkFraction(String name, double value) {
      checkArgument(value >= 0 && value <= 1, "%s must be in [0, 1], was %s", name, value);
    }
  }
}
