package com.verlumen.strategylab.deployment;

import com.google.auto.value.AutoValue;

/** One in-sample / out-of-sample split, by bar index. */
@AutoValue
public abstract class WalkForwardPeriod {
  static Builder builder() {
    return new AutoValue_WalkForwardPeriod.Builder();
  }

  public abstract int index();

  public abstract int inSampleStart();

  public abstract int inSampleEnd();

  public abstract int outOfSampleStart();

  public abstract int outOfSampleEnd();

  public abstract double inSampleReturn();

  public abstract double outOfSampleReturn();

  public abstract double inSampleSharpe();

  public abstract double outOfSampleSharpe();

  public abstract double inSampleDrawdown();

  public abstract double outOfSampleDrawdown();

  /** {@code (IS - OOS) / |IS|}, 0 when the in-sample return is 0. */
  public abstract double returnDegradation();

  public abstract double sharpeDegradation();

  public abstract boolean passed();

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setIndex(int value);

    abstract Builder setInSampleStart(int value);

    abstract Builder setInSampleEnd(int value);

    abstract Builder setOutOfSampleStart(int value);

    abstract Builder setOutOfSampleEnd(int value);

    abstract Builder setInSampleReturn(double value);

    abstract Builder setOutOfSampleReturn(double value);

    abstract Builder setInSampleSharpe(double value);

    abstract Builder setOutOfSampleSharpe(double value);

    abstract Builder setInSampleDrawdown(double value);

    abstract Builder setOutOfSampleDrawdown(double value);

    abstract Builder setReturnDegradation(double value);

    abstract Builder setSharpeDegradation(double value);

    abstract Builder setPassed(boolean value);

    abstract WalkForwardPeriod build();
  }
}
