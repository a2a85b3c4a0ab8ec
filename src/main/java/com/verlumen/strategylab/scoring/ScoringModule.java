package com.verlumen.strategylab.scoring;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;

@AutoValue
public abstract class ScoringModule extends AbstractModule {
  public static ScoringModule create(FitnessProfile profile) {
    return new AutoValue_ScoringModule(profile);
  }

  abstract FitnessProfile profile();

  @Override
  protected void configure() {
    bind(FitnessProfile.class).toInstance(profile());
    bind(CompositeScorer.class).to(CompositeScorerImpl.class);
  }
}
