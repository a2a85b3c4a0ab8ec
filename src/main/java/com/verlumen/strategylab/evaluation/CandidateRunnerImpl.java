package com.verlumen.strategylab.evaluation;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.gson.Gson;
import com.google.inject.Inject;
import com.verlumen.strategylab.genome.Version;
import com.verlumen.strategylab.marketdata.Candle;
import com.verlumen.strategylab.marketdata.MarketConfig;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

final class CandidateRunnerImpl implements CandidateRunner {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String CSV_HEADER = "time,open,high,low,close,volume";
  private static final double ESTIMATED_DRAWDOWN = 0.1;
  private static final double ESTIMATED_WIN_RATE = 0.5;

  private final BacktestExecutor executor;
  private final ExecutionCostModel costModel;
  private final EvaluatorConfig config;
  private final Gson gson;

  @Inject
  CandidateRunnerImpl(
      BacktestExecutor executor, ExecutionCostModel costModel, EvaluatorConfig config, Gson gson) {
    this.executor = executor;
    this.costModel = costModel;
    this.config = config;
    this.gson = gson;
  }

  @Override
  public BacktestOutcome run(Version version, MarketConfig market, List<Candle> candles)
      throws EvaluationException {
    checkArgument(!candles.isEmpty(), "No candles for %s", market);
    Path workDir = null;
    try {
      workDir = Files.createTempDirectory("candidate-" + version.id() + "-");
      ExecutionRequest request = materialize(workDir, version, candles);
      ExecutionResult result = executor.execute(request);
      Optional<BacktestOutput> output = BacktestOutputParser.parse(result.outputDir());
      if (output.isEmpty()) {
        logger.atWarning().log(
            "No executor output for %s on %s; estimating from prices", version.key(), market);
        return estimate(market, candles);
      }
      return measure(market, candles, output.get());
    } catch (ExecutorException e) {
      throw new EvaluationException("Executor failed for " + market + ": " + e.getMessage(), e);
    } catch (IOException e) {
      throw new EvaluationException("I/O failure evaluating " + market, e);
    } finally {
      if (workDir != null) {
        deleteQuietly(workDir);
      }
    }
  }

  private ExecutionRequest materialize(Path workDir, Version version, List<Candle> candles)
      throws IOException {
    Path script = workDir.resolve("strategy.py");
    Files.writeString(script, version.source(), StandardCharsets.UTF_8);

    Path data = workDir.resolve("data.csv");
    try (BufferedWriter writer = Files.newBufferedWriter(data, StandardCharsets.UTF_8)) {
      writer.write(CSV_HEADER);
      writer.write('\n');
      for (Candle candle : candles) {
        writer.write(
            String.join(
                ",",
                Long.toString(candle.openTime().toEpochMilli()),
                Double.toString(candle.open()),
                Double.toString(candle.high()),
                Double.toString(candle.low()),
                Double.toString(candle.close()),
                Double.toString(candle.volume())));
        writer.write('\n');
      }
    }

    Path parameters = workDir.resolve("parameters.json");
    Files.writeString(
        parameters,
        gson.toJson(ImmutableSortedMap.copyOf(version.parameters())),
        StandardCharsets.UTF_8);

    Path outputDir = Files.createDirectory(workDir.resolve("output"));
    return ExecutionRequest.create(
        script, data, parameters, outputDir, config.executorTimeout());
  }

  private BacktestOutcome measure(
      MarketConfig market, List<Candle> candles, BacktestOutput output) {
    ImmutableList<Double> pnls =
        output.trades().stream().map(Trade::pnl).collect(toImmutableList());
    ImmutableList<Double> returns = PerformanceMath.returns(output.equity());
    MetricsRecord record =
        baseRecord(market, candles)
            .setPnl(pnls.stream().mapToDouble(Double::doubleValue).sum())
            .setSharpeRatio(PerformanceMath.sharpeRatio(returns))
            .setMaxDrawdown(PerformanceMath.maxDrawdown(output.equity()))
            .setWinRate(PerformanceMath.winRate(pnls))
            .setProfitFactor(PerformanceMath.profitFactor(pnls))
            .setNumTrades(pnls.size())
            .setMarketImpact(costModel.marketImpact(output.trades(), candles))
            .setVolatilityAdjustedReturn(PerformanceMath.volatilityAdjustedReturn(returns))
            .setDownsideDeviation(PerformanceMath.downsideDeviation(returns))
            .build();
    return BacktestOutcome.create(market, record, output.equity(), pnls);
  }

  /** Buy-and-hold stand-in with pessimistic drawdown and no trades. */
  private BacktestOutcome estimate(MarketConfig market, List<Candle> candles) {
    ImmutableList<Double> closes = candles.stream().map(Candle::close).collect(toImmutableList());
    ImmutableList<Double> returns = PerformanceMath.returns(closes);
    double pnl = returns.stream().mapToDouble(Double::doubleValue).sum() * 100;
    MetricsRecord record =
        baseRecord(market, candles)
            .setPnl(pnl)
            .setSharpeRatio(PerformanceMath.sharpeRatio(returns))
            .setMaxDrawdown(ESTIMATED_DRAWDOWN)
            .setWinRate(ESTIMATED_WIN_RATE)
            .setProfitFactor(1.0)
            .setNumTrades(0)
            .setEstimated(true)
            .build();
    return BacktestOutcome.create(market, record, closes, ImmutableList.of());
  }

  private MetricsRecord.Builder baseRecord(MarketConfig market, List<Candle> candles) {
    Instant start = candles.get(0).openTime();
    Instant end = candles.get(candles.size() - 1).openTime().plus(market.timeframe().duration());
    return MetricsRecord.builder()
        .setMarket(market.symbol())
        .setTimeframe(market.timeframe())
        .setWindowStart(start)
        .setWindowEnd(end)
        .setSlippage(costModel.slippage(market))
        .setExecutionDelayMs(costModel.executionDelayMs(market));
  }

  private static void deleteQuietly(Path workDir) {
    try {
      MoreFiles.deleteRecursively(workDir, RecursiveDeleteOption.ALLOW_INSECURE);
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Could not delete %s", workDir);
    }
  }
}
