package com.verlumen.strategylab.mutation;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.stream.Collectors.joining;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

@AutoValue
public abstract class ValidationReport {
  static ValidationReport create(Iterable<ValidationIssue> issues) {
    return new AutoValue_ValidationReport(ImmutableList.copyOf(issues));
  }

  public abstract ImmutableList<ValidationIssue> issues();

  public boolean valid() {
    return errors().isEmpty();
  }

  public ImmutableList<ValidationIssue> errors() {
    return issues().stream()
        .filter(issue -> issue.severity() == ValidationIssue.Severity.ERROR)
        .collect(toImmutableList());
  }

  /** Errors joined one per line, for corrective prompts and logs. */
  public String summary() {
    return errors().stream().map(ValidationIssue::toString).collect(joining("\n"));
  }
}
