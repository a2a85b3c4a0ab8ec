package com.verlumen.strategylab.deployment;

import com.verlumen.strategylab.evaluation.EvaluationException;
import com.verlumen.strategylab.genome.CandidateKey;

/** Decides whether a candidate version is fit for live deployment. */
public interface DeploymentGate {
  /**
   * Runs multi-market validation, profit analysis, walk-forward validation and robustness
   * simulation, scores the outcome and records the ready flag on the version.
   *
   * @throws EvaluationException if the version is unknown
   */
  ReadinessReport assess(CandidateKey key) throws EvaluationException;
}
