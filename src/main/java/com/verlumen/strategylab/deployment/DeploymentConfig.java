package com.verlumen.strategylab.deployment;

import com.google.auto.value.AutoValue;

/** Everything the deployment gate needs besides the candidate itself. */
@AutoValue
public abstract class DeploymentConfig {
  public static DeploymentConfig defaults() {
    return create(
        ValidationChecklist.defaults(),
        WalkForwardConfig.defaults(),
        SimulationConfig.defaults(),
        30,
        200);
  }

  public static DeploymentConfig create(
      ValidationChecklist checklist,
      WalkForwardConfig walkForward,
      SimulationConfig simulation,
      int matrixLookbackDays,
      int matrixMinDataPoints) {
    return new AutoValue_DeploymentConfig(
        checklist, walkForward, simulation, matrixLookbackDays, matrixMinDataPoints);
  }

  public abstract ValidationChecklist checklist();

  public abstract WalkForwardConfig walkForward();

  public abstract SimulationConfig simulation();

  /** Look-back of each market in the standard validation matrix. */
  public abstract int matrixLookbackDays();

  public abstract int matrixMinDataPoints();
}
