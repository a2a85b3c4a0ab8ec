package com.verlumen.strategylab.evolution;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.verlumen.strategylab.evaluation.AggregatedMetrics;
import com.verlumen.strategylab.evaluation.MetricsAggregator;
import com.verlumen.strategylab.evaluation.TestRecords;
import com.verlumen.strategylab.genome.CandidateKey;
import com.verlumen.strategylab.genome.Genome;
import com.verlumen.strategylab.scoring.DeploymentVerdict;

final class TestCandidates {
  static final Genome BASE =
      Genome.builder()
          .setName("exhaustion")
          .setSource(
              String.join(
                  "\n",
                  "\"\"\"@pyne\"\"\"",
                  "from pynecore.lib import script, close, input, plot",
                  "",
                  "@script.indicator(\"Exhaustion\", overlay=True)",
                  "def main(a: int = input.int(9, \"A\")):",
                  "    fast = close.sma(a)",
                  "    if close[4] < close and close[2] < close:",
                  "        plot(fast, \"Fast\")"))
          .setParameters(ImmutableMap.of("a", 9.0, "b", 12.0, "c", 14.0))
          .build();

  static final AggregatedMetrics METRICS =
      MetricsAggregator.aggregate(
          ImmutableList.of(
              TestRecords.record("BTC/USD").build(),
              TestRecords.record("ETH/USD").build(),
              TestRecords.record("SOL/USD").build()));

  static ScoredCandidate scored(String genomeId, double fitness) {
    return ScoredCandidate.create(
        CandidateKey.create(genomeId, "v-" + genomeId),
        METRICS,
        fitness,
        DeploymentVerdict.create(ImmutableList.of()));
  }

  private TestCandidates() {}
}
