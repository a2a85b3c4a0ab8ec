package com.verlumen.strategylab.marketdata;

import com.google.auto.value.AutoValue;
import com.google.common.base.Ticker;
import com.google.inject.AbstractModule;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.strategylab.execution.RunMode;

@AutoValue
public abstract class MarketDataModule extends AbstractModule {
  public static MarketDataModule create(MarketDataConfig config) {
    return new AutoValue_MarketDataModule(config);
  }

  abstract MarketDataConfig config();

  @Override
  protected void configure() {
    bind(MarketDataConfig.class).toInstance(config());
    bind(Ticker.class).toInstance(Ticker.systemTicker());
    bind(MarketDataCache.class).to(MarketDataCacheImpl.class).in(Singleton.class);
  }

  @Provides
  MarketDataSource provideMarketDataSource(
      RunMode runMode,
      Provider<BinanceMarketDataSource> binance,
      Provider<SyntheticMarketDataSource> synthetic) {
    return runMode == RunMode.DRY ? synthetic.get() : binance.get();
  }
}
