package com.verlumen.strategylab.evolution;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.strategylab.evaluation.AggregatedMetrics;
import com.verlumen.strategylab.evaluation.BatchEvaluation;
import com.verlumen.strategylab.evaluation.ConcurrentEvaluator;
import com.verlumen.strategylab.genome.CandidateKey;
import com.verlumen.strategylab.genome.Genome;
import com.verlumen.strategylab.mutation.MutationDispatcher;
import com.verlumen.strategylab.mutation.MutationKind;
import com.verlumen.strategylab.registry.CandidateRegistry;
import com.verlumen.strategylab.scoring.CompositeScorer;
import com.verlumen.strategylab.scoring.DeploymentVerdict;
import com.verlumen.strategylab.scoring.FitnessProfile;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

final class EvolutionLoopImpl implements EvolutionLoop {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final PopulationSeeder seeder;
  private final ConcurrentEvaluator evaluator;
  private final CompositeScorer scorer;
  private final FitnessProfile profile;
  private final CandidateRegistry registry;
  private final MutationDispatcher dispatcher;
  private final TournamentSelector selector;
  private final Random random;

  @Inject
  EvolutionLoopImpl(
      PopulationSeeder seeder,
      ConcurrentEvaluator evaluator,
      CompositeScorer scorer,
      FitnessProfile profile,
      CandidateRegistry registry,
      MutationDispatcher dispatcher,
      TournamentSelector selector,
      Random random) {
    this.seeder = seeder;
    this.evaluator = evaluator;
    this.scorer = scorer;
    this.profile = profile;
    this.registry = registry;
    this.dispatcher = dispatcher;
    this.selector = selector;
    this.random = random;
  }

  @Override
  public EvolutionResult run(Genome base, EvolutionConfig config) {
    logger.atInfo().log(
        "Starting evolution of %s: population %d, up to %d generations, profile %s",
        base.name(), config.populationSize(), config.maxGenerations(), profile.name());
    List<CandidateKey> population = seeder.seed(base, config);
    List<GenerationSummary> history = new ArrayList<>();
    Optional<ScoredCandidate> best = Optional.empty();
    double bestFitness = Double.NEGATIVE_INFINITY;
    int stale = 0;
    StopReason stopReason = StopReason.MAX_GENERATIONS;

    for (int generation = 1; generation <= config.maxGenerations(); generation++) {
      GenerationOutcome outcome = runGeneration(generation, population, config);
      history.add(outcome.summary());
      population = outcome.nextPopulation();

      Optional<ScoredCandidate> generationBest = outcome.ranked().stream().findFirst();
      if (generationBest.isPresent() && generationBest.get().fitness() > bestFitness) {
        bestFitness = generationBest.get().fitness();
        best = generationBest;
        stale = 0;
      } else {
        stale++;
      }
      if (stale >= config.patience()) {
        logger.atInfo().log(
            "No improvement for %d generations; stopping after generation %d", stale, generation);
        stopReason = StopReason.CONVERGED;
        break;
      }
    }

    EvolutionResult result = EvolutionResult.create(population, history, stopReason, best);
    logger.atInfo().log(
        "Evolution finished after %d generations (%s); best fitness %.4f",
        result.generationsCompleted(), stopReason, result.bestFitness());
    return result;
  }

  @Override
  public GenerationOutcome runGeneration(
      int generation, List<CandidateKey> population, EvolutionConfig config) {
    logger.atInfo().log("Generation %d: evaluating %d candidates", generation, population.size());
    BatchEvaluation batch = evaluator.batchEvaluate(population, config.generationTimeout());

    List<ScoredCandidate> scored = new ArrayList<>();
    batch
        .results()
        .forEach(
            (key, metrics) -> {
              double fitness = scorer.score(metrics, profile);
              DeploymentVerdict verdict = scorer.isDeploymentReady(fitness, metrics, profile);
              scored.add(ScoredCandidate.create(key, metrics, fitness, verdict));
            });
    ImmutableList<ScoredCandidate> ranked =
        scored.stream().sorted(ScoredCandidate.RANKING).collect(toImmutableList());
    ranked.stream()
        .filter(candidate -> candidate.verdict().ready())
        .forEach(candidate -> registry.markReady(candidate.key(), true));

    GenerationSummary summary = summarize(generation, population.size(), ranked, batch);
    logger.atInfo().log(
        "Generation %d: best %.4f, avg %.4f, %d ready, %d unscored",
        generation,
        summary.bestFitness(),
        summary.avgFitness(),
        summary.deploymentReady(),
        summary.failed());

    ImmutableList<CandidateKey> next;
    if (ranked.isEmpty()) {
      logger.atWarning().log(
          "Generation %d produced no scored candidates; carrying population over", generation);
      next = ImmutableList.copyOf(population);
    } else {
      next = reproduce(generation, ranked, population.size(), config);
    }
    return GenerationOutcome.create(ranked, summary, next);
  }

  private ImmutableList<CandidateKey> reproduce(
      int generation, List<ScoredCandidate> ranked, int size, EvolutionConfig config) {
    List<CandidateKey> next = new ArrayList<>();
    ranked.stream()
        .limit(config.eliteSize())
        .map(ScoredCandidate::key)
        .forEach(next::add);

    while (next.size() < size) {
      ScoredCandidate parent = selector.select(ranked);
      if (nextDouble() < config.mutationRate()) {
        Genome parentGenome = registry.genome(parent.key().genomeId()).orElseThrow().genome();
        MutationKind kind = pick(PopulationSeeder.INDIVIDUAL_KINDS);
        Genome offspring = dispatcher.mutate(parentGenome, kind);
        String note = "Generation " + (generation + 1) + " offspring via " + kind.label();
        Genome savedOffspring = save(offspring, note, next);
        for (int variant = 1;
            variant < config.variantsPerIndividual() && next.size() < size;
            variant++) {
          save(
              dispatcher.mutate(savedOffspring, pick(PopulationSeeder.VARIANT_KINDS)),
              "Variant " + variant + " of " + savedOffspring.name(),
              next);
        }
      } else {
        next.add(parent.key());
      }
    }
    return ImmutableList.copyOf(next);
  }

  private Genome save(Genome genome, String note, List<CandidateKey> population) {
    String id = registry.save(genome, note);
    population.add(registry.genome(id).orElseThrow().currentKey());
    return genome.withId(id);
  }

  private static GenerationSummary summarize(
      int generation, int populationSize, List<ScoredCandidate> ranked, BatchEvaluation batch) {
    Map<CandidateKey, ImmutableList<String>> denied = new LinkedHashMap<>();
    ranked.stream()
        .filter(candidate -> !candidate.verdict().ready())
        .forEach(candidate -> denied.put(candidate.key(), candidate.verdict().reasons()));
    ImmutableSortedSet<String> markets =
        ranked.stream()
            .map(ScoredCandidate::metrics)
            .map(AggregatedMetrics::marketsTested)
            .flatMap(ImmutableSortedSet::stream)
            .collect(ImmutableSortedSet.toImmutableSortedSet(Comparator.naturalOrder()));
    return GenerationSummary.builder()
        .setGeneration(generation)
        .setBestFitness(ranked.isEmpty() ? 0.0 : ranked.get(0).fitness())
        .setAvgFitness(
            ranked.stream().mapToDouble(ScoredCandidate::fitness).average().orElse(0.0))
        .setPopulationSize(populationSize)
        .setEvaluated(ranked.size())
        .setFailed(batch.failures().size())
        .setDeploymentReady((int) ranked.stream().filter(c -> c.verdict().ready()).count())
        .setMarketDiversity(markets.size())
        .setBestCandidate(ranked.stream().findFirst().map(ScoredCandidate::key))
        .setDeniedReasons(denied)
        .setFailureReasons(batch.failures())
        .build();
  }

  private double nextDouble() {
    synchronized (random) {
      return random.nextDouble();
    }
  }

  private MutationKind pick(List<MutationKind> kinds) {
    synchronized (random) {
      return kinds.get(random.nextInt(kinds.size()));
    }
  }
}
