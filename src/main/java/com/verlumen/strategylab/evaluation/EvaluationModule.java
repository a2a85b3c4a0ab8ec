package com.verlumen.strategylab.evaluation;

import com.google.auto.value.AutoValue;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.strategylab.execution.RunMode;
import java.util.concurrent.Executors;

@AutoValue
public abstract class EvaluationModule extends AbstractModule {
  public static EvaluationModule create(EvaluatorConfig config) {
    return new AutoValue_EvaluationModule(config);
  }

  abstract EvaluatorConfig config();

  @Override
  protected void configure() {
    bind(EvaluatorConfig.class).toInstance(config());
    bind(CandidateRunner.class).to(CandidateRunnerImpl.class);
    bind(ExecutionCostModel.class).to(DefaultExecutionCostModel.class);
    bind(ConcurrentEvaluator.class).to(ConcurrentEvaluatorImpl.class).in(Singleton.class);
  }

  @Provides
  BacktestExecutor provideBacktestExecutor(
      RunMode runMode,
      Provider<ProcessBacktestExecutor> process,
      Provider<DryRunBacktestExecutor> dryRun) {
    return runMode == RunMode.DRY ? dryRun.get() : process.get();
  }

  @Provides
  @Singleton
  ListeningExecutorService provideWorkerPool() {
    return MoreExecutors.listeningDecorator(
        Executors.newFixedThreadPool(
            config().workerBudget(),
            new ThreadFactoryBuilder().setNameFormat("evaluator-%d").setDaemon(true).build()));
  }
}
