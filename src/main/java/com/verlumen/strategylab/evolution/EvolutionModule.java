package com.verlumen.strategylab.evolution;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import java.util.OptionalLong;
import java.util.Random;

@AutoValue
public abstract class EvolutionModule extends AbstractModule {
  /** @param seed fixes every random choice of a run when present */
  public static EvolutionModule create(OptionalLong seed) {
    return new AutoValue_EvolutionModule(seed);
  }

  abstract OptionalLong seed();

  @Override
  protected void configure() {
    bind(EvolutionLoop.class).to(EvolutionLoopImpl.class);
  }

  @Provides
  @Singleton
  Random provideRandom() {
    return seed().isPresent() ? new Random(seed().getAsLong()) : new Random();
  }
}
