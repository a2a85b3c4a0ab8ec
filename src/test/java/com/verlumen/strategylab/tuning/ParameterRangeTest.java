package com.verlumen.strategylab.tuning;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParameterRangeTest {
  @Test
  public void around_positiveValue_spansHalfEitherSide() {
    assertThat(ParameterRange.around(10.0)).isEqualTo(ParameterRange.create(5.0, 15.0));
  }

  @Test
  public void around_negativeValue_keepsOrder() {
    assertThat(ParameterRange.around(-4.0)).isEqualTo(ParameterRange.create(-6.0, -2.0));
  }

  @Test
  public void around_zero_isUnitInterval() {
    assertThat(ParameterRange.around(0.0)).isEqualTo(ParameterRange.create(-1.0, 1.0));
  }

  @Test
  public void around_map_coversEveryParameter() {
    assertThat(ParameterRange.around(ImmutableMap.of("a", 2.0, "b", 8.0)).keySet())
        .containsExactly("a", "b");
  }

  @Test
  public void create_invertedBounds_throws() {
    assertThrows(IllegalArgumentException.class, () -> ParameterRange.create(2.0, 1.0));
  }
}
