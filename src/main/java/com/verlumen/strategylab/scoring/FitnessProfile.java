package com.verlumen.strategylab.scoring;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.Map;

/**
 * Named weighting and threshold configuration that turns metrics into one comparable score.
 *
 * <p>Weights must be non-negative and sum to 1.0 within 5%; construction fails otherwise.
 * Criteria absent from the weight map carry zero weight.
 */
@AutoValue
public abstract class FitnessProfile {
  static final double MIN_TOTAL_WEIGHT = 0.95;
  static final double MAX_TOTAL_WEIGHT = 1.05;

  public static FitnessProfile create(
      String name,
      Map<Criterion, Double> weights,
      DeploymentThresholds thresholds,
      NormalizationRanges normalization) {
    checkArgument(!name.isEmpty(), "Profile name cannot be empty");
    double total = 0;
    for (Map.Entry<Criterion, Double> entry : weights.entrySet()) {
      checkArgument(
          entry.getValue() >= 0, "Weight for %s cannot be negative", entry.getKey().key());
      total += entry.getValue();
    }
    checkArgument(
        total >= MIN_TOTAL_WEIGHT && total <= MAX_TOTAL_WEIGHT,
        "Fitness weights for %s must sum to ~1.0, got %s",
        name,
        total);
    return new AutoValue_FitnessProfile(
        name, Maps.immutableEnumMap(weights), thresholds, normalization);
  }

  public abstract String name();

  public abstract ImmutableMap<Criterion, Double> weights();

  public abstract DeploymentThresholds thresholds();

  public abstract NormalizationRanges normalization();

  public double weight(Criterion criterion) {
    return weights().getOrDefault(criterion, 0.0);
  }
}
