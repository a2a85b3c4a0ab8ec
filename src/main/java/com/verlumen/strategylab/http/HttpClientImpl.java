package com.verlumen.strategylab.http;

import com.google.common.flogger.FluentLogger;
import com.google.common.io.CharStreams;
import com.google.inject.Inject;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.Reader;
import java.net.HttpURLConnection;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

final class HttpClientImpl implements HttpClient {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final HttpURLConnectionFactory httpURLConnectionFactory;

  @Inject
  HttpClientImpl(HttpURLConnectionFactory httpURLConnectionFactory) {
    this.httpURLConnectionFactory = httpURLConnectionFactory;
  }

  @Override
  public String get(String url, Map<String, String> headers, Duration timeout)
      throws IOException {
    return execute("GET", url, headers, null, timeout);
  }

  @Override
  public String post(String url, Map<String, String> headers, String body, Duration timeout)
      throws IOException {
    return execute("POST", url, headers, body, timeout);
  }

  private String execute(
      String method, String url, Map<String, String> headers, String body, Duration timeout)
      throws IOException {
    logger.atFine().log("Making %s request to URL: %s", method, url);

    HttpURLConnection con = null;
    try {
      con = httpURLConnectionFactory.create(url);
      con.setRequestMethod(method);
      int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
      con.setConnectTimeout(timeoutMillis);
      con.setReadTimeout(timeoutMillis);
      for (Map.Entry<String, String> header : headers.entrySet()) {
        con.setRequestProperty(header.getKey(), header.getValue());
      }

      if (body != null) {
        con.setDoOutput(true);
        try (OutputStream out = con.getOutputStream()) {
          out.write(body.getBytes(StandardCharsets.UTF_8));
        }
      }

      int responseCode = con.getResponseCode();
      logger.atFine().log("Received response code: %d", responseCode);
      if (responseCode != HttpURLConnection.HTTP_OK) {
        throw new IOException(
            String.format("%s %s failed: HTTP code %d", method, url, responseCode));
      }

      String response = read(con.getInputStream());
      logger.atFine().log("Response length: %d characters", response.length());
      return response;
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("Failed to execute %s request to %s", method, url);
      throw e;
    } finally {
      if (con != null) {
        con.disconnect();
      }
    }
  }

  private static String read(InputStream stream) throws IOException {
    try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
      return CharStreams.toString(reader);
    }
  }
}
