package com.verlumen.strategylab.registry;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import java.time.Clock;
import javax.sql.DataSource;
import org.h2.jdbcx.JdbcConnectionPool;

@AutoValue
public abstract class RegistryModule extends AbstractModule {
  public static RegistryModule create(RegistryConfig config) {
    return new AutoValue_RegistryModule(config);
  }

  abstract RegistryConfig config();

  @Override
  protected void configure() {
    bind(Clock.class).toInstance(Clock.systemUTC());
    bind(CandidateRegistry.class).to(H2CandidateRegistry.class).in(Singleton.class);
  }

  @Provides
  @Singleton
  DataSource provideDataSource() {
    return JdbcConnectionPool.create(config().jdbcUrl(), config().user(), config().password());
  }
}
