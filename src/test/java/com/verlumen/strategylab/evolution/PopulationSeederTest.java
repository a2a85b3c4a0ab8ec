package com.verlumen.strategylab.evolution;

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.strategylab.genome.CandidateKey;
import com.verlumen.strategylab.genome.Genome;
import com.verlumen.strategylab.mutation.MutationDispatcher;
import com.verlumen.strategylab.mutation.MutationKind;
import com.verlumen.strategylab.registry.CandidateRegistry;
import com.verlumen.strategylab.registry.RegistryConfig;
import com.verlumen.strategylab.registry.RegistryModule;
import com.verlumen.strategylab.scoring.FitnessProfiles;
import com.verlumen.strategylab.scoring.ScoringModule;
import java.util.Optional;
import java.util.Random;
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
public class PopulationSeederTest {
  @Rule public MockitoRule mocks = MockitoJUnit.rule();

  @Mock @Bind private MutationDispatcher mockDispatcher;
  @Bind private final Random random = new Random(5);

  @Inject private CandidateRegistry registry;
  @Inject private PopulationSeeder seeder;

  @Before
  public void setUp() {
    when(mockDispatcher.mutate(any(), any()))
        .thenAnswer(
            invocation -> {
              Genome parent = invocation.getArgument(0);
              MutationKind kind = invocation.getArgument(1);
              return parent.toBuilder()
                  .setId(Optional.empty())
                  .setName(parent.name() + "_" + kind.label())
                  .setGeneration(parent.generation() + 1)
                  .setParentIds(ImmutableList.of(parent.id().orElseThrow()))
                  .build();
            });
    Guice.createInjector(
            BoundFieldModule.of(this),
            RegistryModule.create(RegistryConfig.inMemory("seeder-" + UUID.randomUUID())),
            ScoringModule.create(FitnessProfiles.defaultProfile()))
        .injectMembers(this);
  }

  @Test
  public void seed_producesExactPopulationSize() {
    for (int size : new int[] {2, 5, 8, 9}) {
      EvolutionConfig config = EvolutionConfig.builder().setPopulationSize(size).build();

      assertThat(seeder.seed(TestCandidates.BASE, config)).hasSize(size);
    }
  }

  @Test
  public void seed_startsWithBaseGenome() {
    // Act
    ImmutableList<CandidateKey> population =
        seeder.seed(TestCandidates.BASE, EvolutionConfig.builder().build());

    // Assert
    Genome first = registry.genome(population.get(0).genomeId()).orElseThrow().genome();
    assertThat(first.name()).isEqualTo("exhaustion");
    assertThat(first.parameters()).isEqualTo(TestCandidates.BASE.parameters());
    assertThat(first.parentIds()).isEmpty();
  }

  @Test
  public void seed_groupsVariantsUnderTheirIndividual() {
    // Arrange
    EvolutionConfig config =
        EvolutionConfig.builder().setPopulationSize(7).setVariantsPerIndividual(3).build();

    // Act
    ImmutableList<CandidateKey> population = seeder.seed(TestCandidates.BASE, config);

    // Assert
    String baseId = population.get(0).genomeId();
    Genome individual = registry.genome(population.get(1).genomeId()).orElseThrow().genome();
    Genome variant = registry.genome(population.get(2).genomeId()).orElseThrow().genome();
    Genome secondIndividual = registry.genome(population.get(4).genomeId()).orElseThrow().genome();
    assertThat(individual.parentIds()).containsExactly(baseId);
    assertThat(variant.parentIds()).containsExactly(population.get(1).genomeId());
    assertThat(variant.generation()).isEqualTo(individual.generation() + 1);
    assertThat(secondIndividual.parentIds()).containsExactly(baseId);
  }

  @Test
  public void seed_keysAreDistinctCurrentVersions() {
    ImmutableList<CandidateKey> population =
        seeder.seed(TestCandidates.BASE, EvolutionConfig.builder().build());

    assertThat(population).containsNoDuplicates();
    for (CandidateKey key : population) {
      assertThat(registry.genome(key.genomeId()).orElseThrow().currentKey()).isEqualTo(key);
    }
  }
}
