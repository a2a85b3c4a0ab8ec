package com.verlumen.strategylab.mutation;

import com.google.auto.value.AutoValue;

@AutoValue
public abstract class ValidationIssue {
  public enum Severity {
    ERROR,
    WARNING
  }

  public enum Category {
    SYNTAX,
    STRUCTURE,
    API,
    SAFETY
  }

  static ValidationIssue error(Category category, int line, String message) {
    return new AutoValue_ValidationIssue(Severity.ERROR, category, line, message);
  }

  static ValidationIssue warning(Category category, int line, String message) {
    return new AutoValue_ValidationIssue(Severity.WARNING, category, line, message);
  }

  public abstract Severity severity();

  public abstract Category category();

  /** One-based line, or 0 when the issue concerns the whole program. */
  public abstract int line();

  public abstract String message();

  @Override
  public final String toString() {
    String location = line() > 0 ? "line " + line() + ": " : "";
    return severity() + " [" + category() + "] " + location + message();
  }
}
