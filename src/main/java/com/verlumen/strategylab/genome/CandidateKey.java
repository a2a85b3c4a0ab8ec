package com.verlumen.strategylab.genome;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.util.Comparator;

/** Identifies one evaluable candidate: a genome pinned to a specific version. */
@AutoValue
public abstract class CandidateKey implements Comparable<CandidateKey> {
  private static final Comparator<CandidateKey> ORDER =
      Comparator.comparing(CandidateKey::genomeId).thenComparing(CandidateKey::versionId);

  public static CandidateKey create(String genomeId, String versionId) {
    checkArgument(!genomeId.isEmpty(), "Genome id cannot be empty");
    checkArgument(!versionId.isEmpty(), "Version id cannot be empty");
    return new AutoValue_CandidateKey(genomeId, versionId);
  }

  public abstract String genomeId();

  public abstract String versionId();

  @Override
  public int compareTo(CandidateKey other) {
    return ORDER.compare(this, other);
  }

  @Override
  public final String toString() {
    return genomeId() + "@" + versionId();
  }
}
