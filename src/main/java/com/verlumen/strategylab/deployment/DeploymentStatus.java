package com.verlumen.strategylab.deployment;

public enum DeploymentStatus {
  APPROVED,
  CONDITIONAL,
  NEEDS_IMPROVEMENT,
  REJECTED;

  /** Whether a candidate with this status may be marked deployment ready. */
  public boolean ready() {
    return this == APPROVED || this == CONDITIONAL;
  }
}
