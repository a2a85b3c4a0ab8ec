package com.verlumen.strategylab.registry;

import com.google.common.collect.ImmutableList;
import com.verlumen.strategylab.evaluation.MetricsRecord;
import com.verlumen.strategylab.genome.CandidateKey;
import com.verlumen.strategylab.genome.Genome;
import com.verlumen.strategylab.genome.Version;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable, versioned store of genomes, their lineage and recorded metrics.
 *
 * <p>Every write runs in its own transaction. Writes for different genomes do not block each
 * other. Nothing is ever deleted. Failures surface as {@link RegistryException}.
 */
public interface CandidateRegistry {
  /** Stores the genome under a fresh id with version 1 as its current version. */
  String save(Genome genome, String note);

  /**
   * Adds a version and makes it current. Returns the current version id unchanged when the content
   * hash matches it.
   */
  String createVersion(
      String genomeId, String source, Map<String, Double> parameters, String note);

  /** Appends a record and updates the genome's fitness and test counts atomically. */
  void recordMetrics(CandidateKey key, MetricsRecord metrics);

  void markReady(CandidateKey key, boolean ready);

  /**
   * Best genomes by fitness, ties broken by distinct markets tested. Only genomes with positive
   * fitness and at least {@code minTests} records qualify; a non-empty {@code marketFilter}
   * further requires at least one of those markets to have been tested.
   */
  ImmutableList<StoredGenome> top(int n, int minTests, Set<String> marketFilter);

  Optional<StoredGenome> genome(String genomeId);

  Optional<Version> version(String versionId);

  Optional<Version> currentVersion(String genomeId);

  /** Version history, oldest first. */
  ImmutableList<Version> versions(String genomeId);

  ImmutableList<MetricsRecord> metrics(CandidateKey key);

  /** Genomes whose current version is marked ready, best deployment score first. */
  ImmutableList<StoredGenome> deploymentReady(int minMarkets);
}
