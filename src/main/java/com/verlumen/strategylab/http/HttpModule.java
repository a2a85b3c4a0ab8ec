package com.verlumen.strategylab.http;

import com.google.inject.AbstractModule;

public final class HttpModule extends AbstractModule {
  public static HttpModule create() {
    return new HttpModule();
  }

  private HttpModule() {}

  @Override
  protected void configure() {
    bind(HttpClient.class).to(HttpClientImpl.class);
    bind(HttpURLConnectionFactory.class).to(HttpURLConnectionFactoryImpl.class);
  }
}
