package com.verlumen.strategylab.deployment;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/** Whatever the four gate stages produced; a stage that could not run is absent. */
@AutoValue
public abstract class StageResults {
  public static Builder builder() {
    return new AutoValue_StageResults.Builder();
  }

  public abstract Optional<MultiMarketResult> multiMarket();

  public abstract Optional<ProfitMetrics> profit();

  public abstract Optional<WalkForwardResult> walkForward();

  public abstract Optional<SimulationResult> simulation();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMultiMarket(MultiMarketResult value);

    public abstract Builder setProfit(ProfitMetrics value);

    public abstract Builder setWalkForward(WalkForwardResult value);

    public abstract Builder setSimulation(SimulationResult value);

    public abstract StageResults build();
  }
}
