package com.verlumen.strategylab.evaluation;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.inject.Inject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * In-process stand-in for the external executor. Simulates a momentum rule whose look-back comes
 * from the candidate's parameters and whose holding period comes from its source text, so distinct
 * candidates produce distinct, repeatable results.
 */
final class DryRunBacktestExecutor implements BacktestExecutor {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final double STARTING_EQUITY = 10_000;
  private static final int DEFAULT_LOOKBACK = 9;
  private static final int MAX_LOOKBACK = 50;
  private static final int MAX_HOLD_BARS = 5;

  @Inject
  DryRunBacktestExecutor() {}

  @Override
  public ExecutionResult execute(ExecutionRequest request) throws ExecutorException {
    try {
      ImmutableList<Double> closes = readCloses(request.data());
      int lookback = lookback(Files.readString(request.parameters(), StandardCharsets.UTF_8));
      String source = Files.readString(request.script(), StandardCharsets.UTF_8);
      int holdBars = 1 + Math.floorMod(source.hashCode(), MAX_HOLD_BARS);
      simulate(closes, lookback, holdBars, request.outputDir());
    } catch (IOException | JsonParseException | IllegalStateException | NumberFormatException e) {
      throw new ExecutorException("Dry run failed: " + e.getMessage(), e);
    }
    logger.atFine().log("Dry run finished for %s", request.script());
    return ExecutionResult.create(0, request.outputDir(), "");
  }

  private static ImmutableList<Double> readCloses(Path data) throws IOException {
    List<String> lines = Files.readAllLines(data, StandardCharsets.UTF_8);
    ImmutableList.Builder<Double> closes = ImmutableList.builder();
    for (String line : lines.subList(1, lines.size())) {
      if (!line.isBlank()) {
        closes.add(Double.parseDouble(line.split(",")[4]));
      }
    }
    return closes.build();
  }

  /** {@code level1} when present, else the smallest positive parameter, else a default. */
  static int lookback(String parametersJson) {
    JsonObject parameters = JsonParser.parseString(parametersJson).getAsJsonObject();
    double chosen = Double.NaN;
    if (parameters.has("level1")) {
      chosen = parameters.get("level1").getAsDouble();
    } else {
      for (Map.Entry<String, JsonElement> entry : parameters.entrySet()) {
        double value = entry.getValue().getAsDouble();
        if (value >= 1 && (Double.isNaN(chosen) || value < chosen)) {
          chosen = value;
        }
      }
    }
    if (Double.isNaN(chosen)) {
      return DEFAULT_LOOKBACK;
    }
    return (int) Math.max(2, Math.min(MAX_LOOKBACK, Math.round(chosen)));
  }

  private static void simulate(List<Double> closes, int lookback, int holdBars, Path outputDir)
      throws IOException {
    JsonArray trades = new JsonArray();
    JsonArray equityValues = new JsonArray();
    double equity = STARTING_EQUITY;
    int entryBar = -1;
    equityValues.add(equity);
    for (int i = 1; i < closes.size(); i++) {
      if (entryBar >= 0) {
        equity *= closes.get(i) / closes.get(i - 1);
        if (i - entryBar >= holdBars) {
          JsonObject trade = new JsonObject();
          trade.addProperty("pnl", (closes.get(i) / closes.get(entryBar) - 1) * 100);
          trade.addProperty("size", 1.0);
          trades.add(trade);
          entryBar = -1;
        }
      } else if (i >= lookback && closes.get(i) > closes.get(i - lookback)) {
        entryBar = i;
      }
      equityValues.add(equity);
    }

    JsonObject equityFile = new JsonObject();
    equityFile.add("equity", equityValues);
    Files.writeString(
        outputDir.resolve(BacktestOutputParser.TRADES_FILE),
        trades.toString(),
        StandardCharsets.UTF_8);
    Files.writeString(
        outputDir.resolve(BacktestOutputParser.EQUITY_FILE),
        equityFile.toString(),
        StandardCharsets.UTF_8);
  }
}
