package com.verlumen.strategylab.mutation;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.strategylab.execution.RunMode;

@AutoValue
public abstract class MutationModule extends AbstractModule {
  public static MutationModule create(GenerativeServiceConfig config) {
    return new AutoValue_MutationModule(config);
  }

  abstract GenerativeServiceConfig config();

  @Override
  protected void configure() {
    bind(GenerativeServiceConfig.class).toInstance(config());
    bind(MutationDispatcher.class).to(MutationDispatcherImpl.class).in(Singleton.class);
  }

  @Provides
  GenerativeService provideGenerativeService(
      RunMode runMode,
      Provider<OpenAiGenerativeService> openAi,
      Provider<OfflineGenerativeService> offline) {
    return runMode == RunMode.DRY ? offline.get() : openAi.get();
  }
}
