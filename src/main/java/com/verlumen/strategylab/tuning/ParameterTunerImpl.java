package com.verlumen.strategylab.tuning;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.strategylab.genome.Genome;
import io.jenetics.DoubleChromosome;
import io.jenetics.DoubleGene;
import io.jenetics.EliteSelector;
import io.jenetics.Genotype;
import io.jenetics.Mutator;
import io.jenetics.Phenotype;
import io.jenetics.SinglePointCrossover;
import io.jenetics.TournamentSelector;
import io.jenetics.engine.Engine;
import io.jenetics.engine.EvolutionResult;
import io.jenetics.engine.EvolutionStatistics;
import java.util.Map;

final class ParameterTunerImpl implements ParameterTuner {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Inject
  ParameterTunerImpl() {}

  @Override
  public TuningResult tune(
      Genome genome,
      Map<String, ParameterRange> ranges,
      TuningObjective objective,
      TuningSettings settings) {
    checkArgument(!ranges.isEmpty(), "At least one parameter needs a range");
    checkArgument(
        genome.parameters().keySet().containsAll(ranges.keySet()),
        "Ranges %s name parameters missing from %s",
        ranges.keySet(),
        genome.parameters().keySet());
    // Chromosome i tunes the i-th name in sorted order.
    ImmutableList<String> names = ImmutableSortedSet.copyOf(ranges.keySet()).asList();

    ImmutableList.Builder<DoubleChromosome> chromosomes = ImmutableList.builder();
    for (String name : names) {
      ParameterRange range = ranges.get(name);
      chromosomes.add(DoubleChromosome.of(range.min(), range.max()));
    }
    Genotype<DoubleGene> genotype = Genotype.of(chromosomes.build());

    Engine<DoubleGene, Double> engine =
        Engine.builder(
                (Genotype<DoubleGene> candidate) ->
                    Double.valueOf(objective.evaluate(parameters(genome, names, candidate))),
                genotype)
            .populationSize(settings.populationSize())
            .offspringSelector(
                new TournamentSelector<DoubleGene, Double>(settings.tournamentSize()))
            .survivorsSelector(
                new EliteSelector<DoubleGene, Double>(
                    settings.eliteCount(),
                    new TournamentSelector<DoubleGene, Double>(settings.tournamentSize())))
            .alterers(
                new Mutator<DoubleGene, Double>(settings.mutationRate()),
                new SinglePointCrossover<DoubleGene, Double>(settings.crossoverRate()))
            .build();

    EvolutionStatistics<Double, ?> statistics = EvolutionStatistics.ofNumber();
    Phenotype<DoubleGene, Double> best =
        engine.stream()
            .limit(settings.generations())
            .peek(statistics)
            .peek(
                result ->
                    logger.atFine().log(
                        "Tuning generation %d best fitness=%.6f",
                        result.generation(), result.bestFitness()))
            .collect(EvolutionResult.toBestPhenotype());

    ImmutableMap<String, Double> tuned = parameters(genome, names, best.genotype());
    logger.atInfo().log(
        "Tuned %s over %d generations: best fitness %.6f with %s",
        genome.name(), best.generation(), best.fitness(), tuned);
    logger.atFine().log("Tuning statistics: %s", statistics);
    return TuningResult.create(tuned, best.fitness(), settings.generations());
  }

  /** The genome's parameters with each tuned one replaced by its gene value. */
  private static ImmutableMap<String, Double> parameters(
      Genome genome, ImmutableList<String> names, Genotype<DoubleGene> genotype) {
    ImmutableMap.Builder<String, Double> parameters = ImmutableMap.builder();
    genome.parameters().forEach(
        (name, value) -> {
          int index = names.indexOf(name);
          parameters.put(
              name, index < 0 ? value : genotype.get(index).gene().doubleValue());
        });
    return parameters.buildOrThrow();
  }
}
