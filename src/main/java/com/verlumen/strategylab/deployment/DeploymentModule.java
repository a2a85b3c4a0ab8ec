package com.verlumen.strategylab.deployment;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;

@AutoValue
public abstract class DeploymentModule extends AbstractModule {
  public static DeploymentModule create(DeploymentConfig config) {
    return new AutoValue_DeploymentModule(config);
  }

  abstract DeploymentConfig config();

  @Override
  protected void configure() {
    bind(DeploymentConfig.class).toInstance(config());
    bind(ValidationChecklist.class).toInstance(config().checklist());
    bind(WalkForwardConfig.class).toInstance(config().walkForward());
    bind(SimulationConfig.class).toInstance(config().simulation());
    bind(OverfittingPolicy.class).to(DefaultOverfittingPolicy.class);
    bind(DeploymentGate.class).to(DeploymentGateImpl.class);
  }
}
