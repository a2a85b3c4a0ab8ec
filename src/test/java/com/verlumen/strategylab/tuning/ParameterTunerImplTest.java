package com.verlumen.strategylab.tuning;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.strategylab.genome.Genome;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParameterTunerImplTest {
  private static final Genome GENOME =
      Genome.builder()
          .setName("squeeze")
          .setSource("\"\"\"@pyne\"\"\"\ndef main(): pass")
          .setParameters(ImmutableMap.of("length", 5.0, "multiplier", 0.0, "smoothing", 14.0))
          .build();

  /** Peaks at length 3, multiplier -2. */
  private static final TuningObjective PARABOLA =
      parameters ->
          -Math.pow(parameters.get("length") - 3, 2)
              - Math.pow(parameters.get("multiplier") + 2, 2);

  private final TuningSettings settings =
      TuningSettings.defaults().toBuilder().setPopulationSize(40).setGenerations(40).build();

  @Inject private ParameterTuner tuner;

  @Before
  public void setUp() {
    Guice.createInjector(TuningModule.create(settings)).injectMembers(this);
  }

  @Test
  public void tune_smoothObjective_findsThePeak() {
    // Arrange
    ImmutableMap<String, ParameterRange> ranges =
        ImmutableMap.of(
            "length", ParameterRange.create(0, 10), "multiplier", ParameterRange.create(-5, 5));

    // Act
    TuningResult result = tuner.tune(GENOME, ranges, PARABOLA, settings);

    // Assert
    assertThat(result.bestParameters().get("length")).isWithin(0.5).of(3.0);
    assertThat(result.bestParameters().get("multiplier")).isWithin(0.5).of(-2.0);
    assertThat(result.bestScore()).isWithin(1e-9).of(PARABOLA.evaluate(result.bestParameters()));
    assertThat(result.generations()).isEqualTo(40);
  }

  @Test
  public void tune_parametersWithoutRange_keepTheirValue() {
    // Arrange
    ImmutableMap<String, ParameterRange> ranges =
        ImmutableMap.of("length", ParameterRange.create(0, 10));

    // Act
    TuningResult result = tuner.tune(GENOME, ranges, PARABOLA, settings);

    // Assert
    assertThat(result.bestParameters().keySet())
        .containsExactly("length", "multiplier", "smoothing");
    assertThat(result.bestParameters().get("multiplier")).isEqualTo(0.0);
    assertThat(result.bestParameters().get("smoothing")).isEqualTo(14.0);
    assertThat(ranges.get("length").contains(result.bestParameters().get("length"))).isTrue();
  }

  @Test
  public void tune_rangeForUnknownParameter_throws() {
    ImmutableMap<String, ParameterRange> ranges =
        ImmutableMap.of("period", ParameterRange.create(0, 10));

    assertThrows(
        IllegalArgumentException.class, () -> tuner.tune(GENOME, ranges, PARABOLA, settings));
  }

  @Test
  public void tune_noRanges_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> tuner.tune(GENOME, ImmutableMap.of(), PARABOLA, settings));
  }

  @Test
  public void applyTo_replacesParametersOnly() {
    // Arrange
    TuningResult result =
        tuner.tune(
            GENOME, ImmutableMap.of("length", ParameterRange.create(0, 10)), PARABOLA, settings);

    // Act
    Genome tuned = result.applyTo(GENOME);

    // Assert
    assertThat(tuned.source()).isEqualTo(GENOME.source());
    assertThat(tuned.name()).isEqualTo(GENOME.name());
    assertThat(tuned.parameters()).isEqualTo(result.bestParameters());
  }
}
