package com.verlumen.strategylab.deployment;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;

@AutoValue
public abstract class WalkForwardResult {
  /** Scores above this are reported as overfitting. */
  static final double OVERFITTING_THRESHOLD = 60;

  public abstract ImmutableList<WalkForwardPeriod> periods();

  public abstract int periodsPassed();

  public abstract double passRate();

  public abstract double meanInSampleReturn();

  public abstract double meanOutOfSampleReturn();

  public abstract double meanInSampleSharpe();

  public abstract double meanOutOfSampleSharpe();

  public abstract double meanDegradation();

  public abstract double meanSharpeDegradation();

  public abstract double degradationStd();

  /** 0-100, higher means more overfitting. */
  public abstract double overfittingScore();

  /** One minus the coefficient of variation of out-of-sample returns. */
  public abstract double outOfSampleConsistency();

  public abstract boolean performanceStable();

  public boolean overfittingDetected() {
    return overfittingScore() > OVERFITTING_THRESHOLD;
  }

  public int totalPeriods() {
    return periods().size();
  }

  static Builder builder() {
    return new AutoValue_WalkForwardResult.Builder();
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setPeriods(List<WalkForwardPeriod> value);

    abstract Builder setPeriodsPassed(int value);

    abstract Builder setPassRate(double value);

    abstract Builder setMeanInSampleReturn(double value);

    abstract Builder setMeanOutOfSampleReturn(double value);

    abstract Builder setMeanInSampleSharpe(double value);

    abstract Builder setMeanOutOfSampleSharpe(double value);

    abstract Builder setMeanDegradation(double value);

    abstract Builder setMeanSharpeDegradation(double value);

    abstract Builder setDegradationStd(double value);

    abstract Builder setOverfittingScore(double value);

    abstract Builder setOutOfSampleConsistency(double value);

    abstract Builder setPerformanceStable(boolean value);

    abstract WalkForwardResult build();
  }
}
