package com.verlumen.strategylab.tuning;

import com.verlumen.strategylab.genome.Genome;
import java.util.Map;

/**
 * Searches a genome's numeric parameters with a conventional genetic algorithm, leaving its
 * source untouched.
 */
public interface ParameterTuner {
  /**
   * @param ranges search interval per parameter; parameters without a range keep their value
   * @throws IllegalArgumentException if a range names a parameter the genome does not have, or no
   *     parameter has a range
   */
  TuningResult tune(
      Genome genome,
      Map<String, ParameterRange> ranges,
      TuningObjective objective,
      TuningSettings settings);
}
