package com.verlumen.strategylab.deployment;

import com.google.auto.value.AutoValue;

/** One named gate check. A failed critical check rejects the candidate outright. */
@AutoValue
public abstract class CheckResult {
  static CheckResult create(
      String name,
      boolean passed,
      double value,
      double threshold,
      boolean critical,
      String message) {
    return new AutoValue_CheckResult(name, passed, value, threshold, critical, message);
  }

  public abstract String name();

  public abstract boolean passed();

  public abstract double value();

  public abstract double threshold();

  public abstract boolean critical();

  public abstract String message();

  /** {@code name: message}, as listed among failures and warnings. */
  public String describe() {
    return name() + ": " + message();
  }
}
