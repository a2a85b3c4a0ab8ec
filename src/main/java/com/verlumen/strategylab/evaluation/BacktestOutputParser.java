package com.verlumen.strategylab.evaluation;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the executor's {@code trades.json} (an array of objects with {@code pnl} and optional
 * {@code size}) and {@code equity.json} (an object with an {@code equity} array).
 */
final class BacktestOutputParser {
  static final String TRADES_FILE = "trades.json";
  static final String EQUITY_FILE = "equity.json";

  /** Empty when either file is missing. Malformed files are errors, not missing output. */
  static Optional<BacktestOutput> parse(Path outputDir) throws IOException {
    Path trades = outputDir.resolve(TRADES_FILE);
    Path equity = outputDir.resolve(EQUITY_FILE);
    if (!Files.exists(trades) || !Files.exists(equity)) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          BacktestOutput.create(
              parseTrades(Files.readString(trades, StandardCharsets.UTF_8)),
              parseEquity(Files.readString(equity, StandardCharsets.UTF_8))));
    } catch (JsonParseException | IllegalStateException | ClassCastException e) {
      throw new IOException("Malformed executor output in " + outputDir, e);
    }
  }

  static ImmutableList<Trade> parseTrades(String json) {
    ImmutableList.Builder<Trade> trades = ImmutableList.builder();
    for (JsonElement element : JsonParser.parseString(json).getAsJsonArray()) {
      JsonObject trade = element.getAsJsonObject();
      trades.add(Trade.create(number(trade, "pnl"), number(trade, "size")));
    }
    return trades.build();
  }

  static ImmutableList<Double> parseEquity(String json) {
    JsonArray values = JsonParser.parseString(json).getAsJsonObject().getAsJsonArray("equity");
    ImmutableList.Builder<Double> equity = ImmutableList.builder();
    if (values != null) {
      values.forEach(value -> equity.add(value.getAsDouble()));
    }
    return equity.build();
  }

  private static double number(JsonObject object, String field) {
    JsonElement value = object.get(field);
    return value == null || value.isJsonNull() ? 0.0 : value.getAsDouble();
  }

  private BacktestOutputParser() {}
}
