package com.verlumen.strategylab.http;

import com.google.inject.Inject;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URI;

final class HttpURLConnectionFactoryImpl implements HttpURLConnectionFactory {
  @Inject
  HttpURLConnectionFactoryImpl() {}

  @Override
  public HttpURLConnection create(String url) throws IOException {
    return (HttpURLConnection) URI.create(url).toURL().openConnection();
  }
}
