package com.verlumen.strategylab.marketdata;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.common.primitives.Ints;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.inject.Inject;
import com.verlumen.strategylab.http.HttpClient;
import java.io.IOException;
import java.time.Instant;

/** Pulls klines from the public Binance REST API. */
final class BinanceMarketDataSource implements MarketDataSource {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final int MIN_LIMIT = 10;
  private static final int MAX_LIMIT = 1000;

  private final HttpClient httpClient;
  private final MarketDataConfig config;

  @Inject
  BinanceMarketDataSource(HttpClient httpClient, MarketDataConfig config) {
    this.httpClient = httpClient;
    this.config = config;
  }

  @Override
  public ImmutableList<Candle> fetch(MarketConfig market, int limit) throws MarketDataException {
    String baseUrl =
        market.marketType() == MarketType.FUTURES ? config.futuresUrl() : config.spotUrl();
    String url =
        String.format(
            "%s?symbol=%s&interval=%s&limit=%d",
            baseUrl,
            market.symbol(),
            market.timeframe().label(),
            Ints.constrainToRange(limit, MIN_LIMIT, MAX_LIMIT));

    String response;
    try {
      response =
          httpClient.get(
              url, ImmutableMap.of("Accept", "application/json"), config.requestTimeout());
    } catch (IOException e) {
      throw new MarketDataException("Failed to fetch klines for " + market, e);
    }

    ImmutableList<Candle> candles = parse(response, market);
    logger.atFine().log("Fetched %d candles for %s", candles.size(), market);
    return candles;
  }

  static ImmutableList<Candle> parse(String response, MarketConfig market)
      throws MarketDataException {
    try {
      JsonElement root = JsonParser.parseString(response);
      if (!root.isJsonArray()) {
        throw new MarketDataException("Unexpected klines payload for " + market);
      }
      ImmutableList.Builder<Candle> candles = ImmutableList.builder();
      for (JsonElement row : root.getAsJsonArray()) {
        JsonArray kline = row.getAsJsonArray();
        candles.add(
            Candle.create(
                Instant.ofEpochMilli(kline.get(0).getAsLong()),
                kline.get(1).getAsDouble(),
                kline.get(2).getAsDouble(),
                kline.get(3).getAsDouble(),
                kline.get(4).getAsDouble(),
                kline.get(5).getAsDouble()));
      }
      return candles.build();
    } catch (JsonParseException | IllegalStateException | IndexOutOfBoundsException e) {
      throw new MarketDataException("Malformed klines payload for " + market, e);
    }
  }
}
