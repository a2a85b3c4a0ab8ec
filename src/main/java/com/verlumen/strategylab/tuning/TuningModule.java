package com.verlumen.strategylab.tuning;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;

@AutoValue
public abstract class TuningModule extends AbstractModule {
  public static TuningModule create(TuningSettings settings) {
    return new AutoValue_TuningModule(settings);
  }

  abstract TuningSettings settings();

  @Override
  protected void configure() {
    bind(TuningSettings.class).toInstance(settings());
    bind(ParameterTuner.class).to(ParameterTunerImpl.class);
  }
}
