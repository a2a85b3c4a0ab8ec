package com.verlumen.strategylab.genome;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;

/**
 * A candidate trading-signal program: its source text, tunable numeric parameters and lineage.
 *
 * <p>A genome without an id has not been saved to the registry yet. Fitness is carried by value;
 * use {@link #withFitness(double)} to obtain an updated copy.
 */
@AutoValue
public abstract class Genome {
  public abstract Optional<String> id();

  public abstract String name();

  public abstract String description();

  public abstract String source();

  public abstract ImmutableMap<String, Double> parameters();

  public abstract int generation();

  /** Ids of every ancestor, oldest first. */
  public abstract ImmutableList<String> parentIds();

  public abstract double fitness();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_Genome.Builder()
        .setDescription("")
        .setParameters(ImmutableMap.of())
        .setGeneration(0)
        .setParentIds(ImmutableList.of())
        .setFitness(0.0);
  }

  public Genome withId(String id) {
    return toBuilder().setId(id).build();
  }

  public Genome withFitness(double fitness) {
    return toBuilder().setFitness(fitness).build();
  }

  /** The identifier children record as their parent: the stored id, or the name when unsaved. */
  public String lineageId() {
    return id().orElse(name());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setId(String id);

    public abstract Builder setId(Optional<String> id);

    public abstract Builder setName(String name);

    public abstract Builder setDescription(String description);

    public abstract Builder setSource(String source);

    public abstract Builder setParameters(Map<String, Double> parameters);

    public abstract Builder setGeneration(int generation);

    public abstract Builder setParentIds(Iterable<String> parentIds);

    public abstract Builder setFitness(double fitness);

    abstract Genome autoBuild();

    public Genome build() {
      Genome genome = autoBuild();
      checkArgument(!genome.name().isEmpty(), "Genome name cannot be empty");
      checkArgument(genome.generation() >= 0, "Generation cannot be negative");
      return genome;
    }
  }
}
