package com.verlumen.strategylab.http;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/** Minimal blocking HTTP client used by the market-data source and the generative service. */
public interface HttpClient {
  String get(String url, Map<String, String> headers, Duration timeout) throws IOException;

  String post(String url, Map<String, String> headers, String body, Duration timeout)
      throws IOException;
}
