package com.verlumen.strategylab.evolution;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.strategylab.genome.CandidateKey;
import com.verlumen.strategylab.genome.Genome;
import com.verlumen.strategylab.mutation.MutationDispatcher;
import com.verlumen.strategylab.mutation.MutationKind;
import com.verlumen.strategylab.registry.CandidateRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builds the first generation: the base genome, then mutated individuals each followed by sibling
 * variants, until exactly {@code populationSize} candidates are saved.
 */
final class PopulationSeeder {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  static final ImmutableList<MutationKind> INDIVIDUAL_KINDS =
      ImmutableList.of(
          MutationKind.PARAMETER,
          MutationKind.LOGIC,
          MutationKind.INDICATOR_SWAP,
          MutationKind.TIMEFRAME);
  static final ImmutableList<MutationKind> VARIANT_KINDS =
      ImmutableList.of(MutationKind.PARAMETER, MutationKind.LOGIC, MutationKind.INDICATOR_SWAP);

  private final CandidateRegistry registry;
  private final MutationDispatcher dispatcher;
  private final Random random;

  @Inject
  PopulationSeeder(CandidateRegistry registry, MutationDispatcher dispatcher, Random random) {
    this.registry = registry;
    this.dispatcher = dispatcher;
    this.random = random;
  }

  ImmutableList<CandidateKey> seed(Genome base, EvolutionConfig config) {
    List<CandidateKey> population = new ArrayList<>();
    Genome savedBase = save(base, "Initial base genome", population);
    int individual = 0;
    while (population.size() < config.populationSize()) {
      individual++;
      Genome child = dispatcher.mutate(savedBase, pick(INDIVIDUAL_KINDS));
      Genome savedChild =
          save(child, "Generation " + child.generation() + " individual " + individual, population);
      for (int variant = 1;
          variant < config.variantsPerIndividual()
              && population.size() < config.populationSize();
          variant++) {
        save(
            dispatcher.mutate(savedChild, pick(VARIANT_KINDS)),
            "Variant " + variant + " of individual " + individual,
            population);
      }
    }
    logger.atInfo().log(
        "Seeded %d candidates from %s (%d individuals)",
        population.size(), base.name(), individual);
    return ImmutableList.copyOf(population);
  }

  /** Saves the genome, appends its current version to the population and returns it with id. */
  private Genome save(Genome genome, String note, List<CandidateKey> population) {
    String id = registry.save(genome, note);
    population.add(registry.genome(id).orElseThrow().currentKey());
    return genome.withId(id);
  }

  private MutationKind pick(List<MutationKind> kinds) {
    synchronized (random) {
      return kinds.get(random.nextInt(kinds.size()));
    }
  }
}
