package com.verlumen.strategylab.mutation;

import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.inject.Inject;
import com.verlumen.strategylab.http.HttpClient;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.Map;

/** Talks to an OpenAI-compatible {@code /v1/chat/completions} endpoint. */
final class OpenAiGenerativeService implements GenerativeService {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String CHAT_PATH = "/v1/chat/completions";

  private final HttpClient httpClient;
  private final GenerativeServiceConfig config;

  @Inject
  OpenAiGenerativeService(HttpClient httpClient, GenerativeServiceConfig config) {
    this.httpClient = httpClient;
    this.config = config;
  }

  @Override
  public GenerationResult generate(String systemPrompt, String userPrompt, SamplingParams params) {
    JsonObject payload = new JsonObject();
    payload.addProperty("model", config.model());
    JsonArray messages = new JsonArray();
    messages.add(message("system", systemPrompt));
    messages.add(message("user", userPrompt));
    payload.add("messages", messages);
    payload.addProperty("temperature", params.temperature());
    payload.addProperty("top_p", params.topP());
    payload.addProperty("max_tokens", params.maxTokens());

    ImmutableMap.Builder<String, String> headers =
        ImmutableMap.<String, String>builder().put("Content-Type", "application/json");
    if (!config.apiKey().isEmpty()) {
      headers.put("Authorization", "Bearer " + config.apiKey());
    }

    String response;
    try {
      response =
          httpClient.post(
              config.endpoint() + CHAT_PATH,
              headers.buildOrThrow(),
              payload.toString(),
              config.timeout());
    } catch (ConnectException | UnknownHostException e) {
      logger.atWarning().log("Generative service unreachable: %s", e.getMessage());
      return GenerationResult.failure("Service unreachable: " + e.getMessage(), false);
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Generative request failed");
      return GenerationResult.failure("Request failed: " + e.getMessage(), true);
    }
    return parse(response);
  }

  static GenerationResult parse(String response) {
    try {
      JsonObject root = JsonParser.parseString(response).getAsJsonObject();
      JsonArray choices = root.getAsJsonArray("choices");
      if (choices == null || choices.isEmpty()) {
        return GenerationResult.failure("Response has no choices", true);
      }
      JsonObject message = choices.get(0).getAsJsonObject().getAsJsonObject("message");
      JsonElement content = message == null ? null : message.get("content");
      if (content == null || content.isJsonNull()) {
        return GenerationResult.failure("Response has no content", true);
      }
      if (!content.isJsonPrimitive() || !content.getAsJsonPrimitive().isString()) {
        logger.atWarning().log("Generative response content is not text: %s", content);
        return GenerationResult.failure("Response content is not text", true);
      }

      ImmutableMap.Builder<String, Integer> usage = ImmutableMap.builder();
      JsonObject usageObject = root.getAsJsonObject("usage");
      if (usageObject != null) {
        for (Map.Entry<String, JsonElement> entry : usageObject.entrySet()) {
          JsonElement value = entry.getValue();
          if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber()) {
            usage.put(entry.getKey(), value.getAsInt());
          }
        }
      }
      return GenerationResult.success(content.getAsString(), usage.buildOrThrow());
    } catch (JsonParseException
        | IllegalStateException
        | ClassCastException
        | UnsupportedOperationException
        | NumberFormatException e) {
      logger.atWarning().withCause(e).log("Malformed generative response");
      return GenerationResult.failure("Malformed response: " + e.getMessage(), true);
    }
  }

  private static JsonObject message(String role, String content) {
    JsonObject message = new JsonObject();
    message.addProperty("role", role);
    message.addProperty("content", content);
    return message;
  }
}
