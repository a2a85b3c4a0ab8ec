package com.verlumen.strategylab.genome;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, content-hashed snapshot of a genome's source and parameters.
 *
 * <p>{@link #parentVersionId()} is a lookup-only reference to the version this one was derived
 * from; it is never dereferenced eagerly.
 */
@AutoValue
public abstract class Version {
  public abstract String id();

  public abstract String genomeId();

  public abstract int versionNumber();

  public abstract Optional<String> parentVersionId();

  public abstract String commitHash();

  public abstract String source();

  public abstract ImmutableMap<String, Double> parameters();

  /** Free-text description of the change that produced this version. */
  public abstract String note();

  public abstract boolean deploymentReady();

  public abstract boolean validationPassed();

  public abstract Instant createdAt();

  public abstract Builder toBuilder();

  public CandidateKey key() {
    return CandidateKey.create(genomeId(), id());
  }

  public static Builder builder() {
    return new AutoValue_Version.Builder()
        .setNote("")
        .setDeploymentReady(false)
        .setValidationPassed(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setId(String id);

    public abstract Builder setGenomeId(String genomeId);

    public abstract Builder setVersionNumber(int versionNumber);

    public abstract Builder setParentVersionId(Optional<String> parentVersionId);

    public abstract Builder setCommitHash(String commitHash);

    public abstract Builder setSource(String source);

    public abstract Builder setParameters(Map<String, Double> parameters);

    public abstract Builder setNote(String note);

    public abstract Builder setDeploymentReady(boolean deploymentReady);

    public abstract Builder setValidationPassed(boolean validationPassed);

    public abstract Builder setCreatedAt(Instant createdAt);

    public abstract Version build();
  }
}
