package com.verlumen.strategylab.evolution;

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.doAnswer;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.strategylab.evaluation.AggregatedMetrics;
import com.verlumen.strategylab.evaluation.BatchEvaluation;
import com.verlumen.strategylab.evaluation.ConcurrentEvaluator;
import com.verlumen.strategylab.execution.ExecutionModule;
import com.verlumen.strategylab.execution.RunMode;
import com.verlumen.strategylab.genome.CandidateKey;
import com.verlumen.strategylab.http.HttpModule;
import com.verlumen.strategylab.mutation.GenerativeServiceConfig;
import com.verlumen.strategylab.mutation.MutationModule;
import com.verlumen.strategylab.registry.RegistryConfig;
import com.verlumen.strategylab.registry.RegistryModule;
import com.verlumen.strategylab.scoring.CompositeScorer;
import com.verlumen.strategylab.scoring.FitnessProfile;
import com.verlumen.strategylab.scoring.FitnessProfiles;
import com.verlumen.strategylab.scoring.ScoringModule;
import java.util.Collection;
import java.util.List;
import java.util.OptionalLong;
import java.util.UUID;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class EvolutionLoopImplTest {
  @Rule public MockitoRule mocks = MockitoJUnit.rule();

  @Mock @Bind private ConcurrentEvaluator mockEvaluator;

  @Inject private EvolutionLoop loop;
  @Inject private PopulationSeeder seeder;
  @Inject private CompositeScorer scorer;
  @Inject private FitnessProfile profile;

  @Before
  public void setUp() {
    givenEveryCandidateScores(TestCandidates.METRICS);
    Guice.createInjector(
            BoundFieldModule.of(this),
            ExecutionModule.create(RunMode.DRY),
            HttpModule.create(),
            MutationModule.create(GenerativeServiceConfig.defaults()),
            RegistryModule.create(RegistryConfig.inMemory("evolution-" + UUID.randomUUID())),
            ScoringModule.create(FitnessProfiles.defaultProfile()),
            EvolutionModule.create(OptionalLong.of(7)))
        .injectMembers(this);
  }

  @Test
  public void run_singleGeneration_producesScoredResult() {
    // Arrange
    EvolutionConfig config =
        EvolutionConfig.builder().setPopulationSize(4).setMaxGenerations(1).build();

    // Act
    EvolutionResult result = loop.run(TestCandidates.BASE, config);

    // Assert
    assertThat(result.generationsCompleted()).isEqualTo(1);
    assertThat(result.finalPopulation()).hasSize(4);
    assertThat(result.best()).isPresent();
    assertThat(result.bestFitness()).isGreaterThan(0.0);
    assertThat(result.stopReason()).isEqualTo(StopReason.MAX_GENERATIONS);
    GenerationSummary summary = result.history().get(0);
    assertThat(summary.evaluated()).isEqualTo(4);
    assertThat(summary.failed()).isEqualTo(0);
    assertThat(summary.marketDiversity()).isEqualTo(3);
  }

  @Test
  public void runGeneration_identicalMetrics_scoresEveryCandidateAlike() {
    // Arrange
    EvolutionConfig config = EvolutionConfig.builder().setPopulationSize(4).build();
    List<CandidateKey> population = seeder.seed(TestCandidates.BASE, config);
    double expected = scorer.score(TestCandidates.METRICS, profile);

    // Act
    GenerationOutcome outcome = loop.runGeneration(1, population, config);

    // Assert
    assertThat(TestCandidates.METRICS.sharpeRatio()).isWithin(1e-9).of(2.0);
    assertThat(TestCandidates.METRICS.maxDrawdown()).isWithin(1e-9).of(0.1);
    assertThat(TestCandidates.METRICS.winRate()).isWithin(1e-9).of(0.6);
    assertThat(outcome.ranked()).hasSize(4);
    for (ScoredCandidate candidate : outcome.ranked()) {
      assertThat(candidate.fitness()).isWithin(1e-12).of(expected);
      assertThat(candidate.verdict().ready()).isTrue();
    }
    GenerationSummary summary = outcome.summary();
    assertThat(summary.bestFitness()).isWithin(1e-12).of(summary.avgFitness());
    assertThat(summary.bestFitness()).isWithin(1e-12).of(expected);
    // Sharpe 2.0, drawdown 10% and win rate 60% on three markets clear every DEMO threshold.
    assertThat(summary.deploymentReady()).isEqualTo(4);
    assertThat(summary.deniedReasons()).isEmpty();
  }

  @Test
  public void runGeneration_keepsPopulationSizeAcrossGenerations() {
    // Arrange
    EvolutionConfig config =
        EvolutionConfig.builder().setPopulationSize(6).setMutationRate(1.0).build();
    List<CandidateKey> population = seeder.seed(TestCandidates.BASE, config);

    // Act / Assert
    for (int generation = 1; generation <= 3; generation++) {
      population = loop.runGeneration(generation, population, config).nextPopulation();
      assertThat(population).hasSize(6);
    }
  }

  @Test
  public void runGeneration_carriesElitesUnchanged() {
    // Arrange
    EvolutionConfig config =
        EvolutionConfig.builder().setPopulationSize(6).setEliteSize(2).setMutationRate(1.0).build();
    List<CandidateKey> population = seeder.seed(TestCandidates.BASE, config);

    // Act
    GenerationOutcome outcome = loop.runGeneration(1, population, config);

    // Assert
    assertThat(outcome.nextPopulation().subList(0, 2))
        .containsExactly(outcome.ranked().get(0).key(), outcome.ranked().get(1).key())
        .inOrder();
  }

  @Test
  public void runGeneration_rankedBestFirst() {
    EvolutionConfig config = EvolutionConfig.builder().setPopulationSize(5).build();
    List<CandidateKey> population = seeder.seed(TestCandidates.BASE, config);

    GenerationOutcome outcome = loop.runGeneration(1, population, config);

    assertThat(outcome.ranked()).isInOrder(ScoredCandidate.RANKING);
    assertThat(outcome.summary().bestFitness()).isEqualTo(outcome.ranked().get(0).fitness());
  }

  @Test
  public void runGeneration_nothingScored_carriesPopulationOver() {
    // Arrange
    EvolutionConfig config = EvolutionConfig.builder().setPopulationSize(4).build();
    List<CandidateKey> population = seeder.seed(TestCandidates.BASE, config);
    givenEveryCandidateFails("all markets failed");

    // Act
    GenerationOutcome outcome = loop.runGeneration(1, population, config);

    // Assert
    assertThat(outcome.ranked()).isEmpty();
    assertThat(outcome.nextPopulation()).isEqualTo(population);
    assertThat(outcome.summary().failed()).isEqualTo(4);
    assertThat(outcome.summary().failureReasons().values()).containsExactly(
        "all markets failed", "all markets failed", "all markets failed", "all markets failed");
  }

  @Test
  public void run_noImprovement_stopsAfterPatience() {
    // Arrange
    EvolutionConfig config =
        EvolutionConfig.builder()
            .setPopulationSize(4)
            .setMaxGenerations(10)
            .setPatience(2)
            .build();

    // Act
    EvolutionResult result = loop.run(TestCandidates.BASE, config);

    // Assert
    assertThat(result.stopReason()).isEqualTo(StopReason.CONVERGED);
    assertThat(result.generationsCompleted()).isEqualTo(3);
    assertThat(result.finalPopulation()).hasSize(4);
  }

  @Test
  public void run_everyGenerationFails_convergesWithoutBest() {
    // Arrange
    givenEveryCandidateFails("no data");
    EvolutionConfig config =
        EvolutionConfig.builder().setPopulationSize(3).setMaxGenerations(10).setPatience(2).build();

    // Act
    EvolutionResult result = loop.run(TestCandidates.BASE, config);

    // Assert
    assertThat(result.generationsCompleted()).isEqualTo(2);
    assertThat(result.best()).isEmpty();
    assertThat(result.bestFitness()).isEqualTo(0.0);
  }

  private void givenEveryCandidateScores(AggregatedMetrics metrics) {
    doAnswer(
            invocation -> {
              Collection<CandidateKey> keys = invocation.getArgument(0);
              ImmutableMap.Builder<CandidateKey, AggregatedMetrics> results =
                  ImmutableMap.builder();
              keys.stream().distinct().forEach(key -> results.put(key, metrics));
              return BatchEvaluation.create(results.build(), ImmutableMap.of(), false);
            })
        .when(mockEvaluator)
        .batchEvaluate(anyCollection(), any());
  }

  private void givenEveryCandidateFails(String reason) {
    doAnswer(
            invocation -> {
              Collection<CandidateKey> keys = invocation.getArgument(0);
              ImmutableMap.Builder<CandidateKey, String> failures = ImmutableMap.builder();
              keys.stream().distinct().forEach(key -> failures.put(key, reason));
              return BatchEvaluation.create(ImmutableMap.of(), failures.build(), false);
            })
        .when(mockEvaluator)
        .batchEvaluate(anyCollection(), any());
  }
}
