package com.verlumen.strategylab.registry;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSortedSet;
import com.verlumen.strategylab.genome.CandidateKey;
import com.verlumen.strategylab.genome.Genome;

/** A saved genome together with the aggregates the registry maintains for it. */
@AutoValue
public abstract class StoredGenome {
  static StoredGenome create(
      Genome genome,
      String currentVersionId,
      double deploymentScore,
      int totalTests,
      ImmutableSortedSet<String> marketsTested) {
    return new AutoValue_StoredGenome(
        genome, currentVersionId, deploymentScore, totalTests, marketsTested);
  }

  /** The genome with its id set and fitness equal to the stored aggregate. */
  public abstract Genome genome();

  public abstract String currentVersionId();

  public abstract double deploymentScore();

  public abstract int totalTests();

  public abstract ImmutableSortedSet<String> marketsTested();

  public String id() {
    return genome().id().orElseThrow();
  }

  public double fitness() {
    return genome().fitness();
  }

  public CandidateKey currentKey() {
    return CandidateKey.create(id(), currentVersionId());
  }
}
