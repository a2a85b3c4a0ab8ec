package com.verlumen.strategylab.evaluation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.List;

@AutoValue
public abstract class EvaluatorConfig {
  public static final String SCRIPT = "{script}";
  public static final String DATA = "{data}";
  public static final String PARAMETERS = "{parameters}";
  public static final String OUTPUT = "{output}";

  static final ImmutableList<String> DEFAULT_COMMAND =
      ImmutableList.of(
          "pyne", "run", SCRIPT, DATA, "--parameters", PARAMETERS, "--output", OUTPUT);

  public static EvaluatorConfig create(
      int workerBudget,
      int marketCap,
      Duration executorTimeout,
      Duration generationTimeout,
      List<String> executorCommand) {
    checkArgument(workerBudget > 0, "Worker budget must be positive");
    checkArgument(marketCap > 0, "Market cap must be positive");
    checkArgument(!executorCommand.isEmpty(), "Executor command cannot be empty");
    return new AutoValue_EvaluatorConfig(
        workerBudget,
        marketCap,
        executorTimeout,
        generationTimeout,
        ImmutableList.copyOf(executorCommand));
  }

  public static EvaluatorConfig defaults() {
    return create(
        4,
        MarketSampler.DEFAULT_CAP,
        Duration.ofSeconds(120),
        Duration.ofMinutes(30),
        DEFAULT_COMMAND);
  }

  /** Maximum number of (candidate, market) runs in flight at once, across a whole generation. */
  public abstract int workerBudget();

  /** Markets per candidate when none are given explicitly. */
  public abstract int marketCap();

  public abstract Duration executorTimeout();

  public abstract Duration generationTimeout();

  /**
   * Executor argv. The tokens {@value #SCRIPT}, {@value #DATA}, {@value #PARAMETERS} and
   * {@value #OUTPUT} are replaced with the prepared paths.
   */
  public abstract ImmutableList<String> executorCommand();

  public EvaluatorConfig withWorkerBudget(int workerBudget) {
    return create(
        workerBudget, marketCap(), executorTimeout(), generationTimeout(), executorCommand());
  }
}
