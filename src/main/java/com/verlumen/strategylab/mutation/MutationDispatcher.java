package com.verlumen.strategylab.mutation;

import com.verlumen.strategylab.genome.Genome;

/** Produces a child genome from a parent and a mutation kind. */
public interface MutationDispatcher {
  /**
   * Never fails for a well-formed parent: when the generative path cannot produce a valid program
   * the local fallback is applied instead. The child is unsaved, one generation deeper than the
   * parent and carries the parent in its lineage.
   */
  Genome mutate(Genome parent, MutationKind kind);

  MutationStats stats();
}
