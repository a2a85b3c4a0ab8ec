package com.verlumen.strategylab.app;

import static com.google.common.collect.ImmutableMap.toImmutableMap;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.Resources;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Module;
import com.verlumen.strategylab.deployment.DeploymentConfig;
import com.verlumen.strategylab.deployment.DeploymentGate;
import com.verlumen.strategylab.deployment.DeploymentModule;
import com.verlumen.strategylab.deployment.ReadinessReport;
import com.verlumen.strategylab.deployment.SimulationConfig;
import com.verlumen.strategylab.deployment.ValidationChecklist;
import com.verlumen.strategylab.deployment.WalkForwardConfig;
import com.verlumen.strategylab.evaluation.ConcurrentEvaluator;
import com.verlumen.strategylab.evaluation.EvaluationException;
import com.verlumen.strategylab.evaluation.EvaluationModule;
import com.verlumen.strategylab.evaluation.EvaluatorConfig;
import com.verlumen.strategylab.evolution.EvolutionConfig;
import com.verlumen.strategylab.evolution.EvolutionLoop;
import com.verlumen.strategylab.evolution.EvolutionModule;
import com.verlumen.strategylab.evolution.EvolutionResult;
import com.verlumen.strategylab.evolution.GenerationSummary;
import com.verlumen.strategylab.execution.ExecutionModule;
import com.verlumen.strategylab.genome.Genome;
import com.verlumen.strategylab.http.HttpModule;
import com.verlumen.strategylab.marketdata.MarketDataConfig;
import com.verlumen.strategylab.marketdata.MarketDataException;
import com.verlumen.strategylab.marketdata.MarketDataModule;
import com.verlumen.strategylab.mutation.GenerativeServiceConfig;
import com.verlumen.strategylab.mutation.MutationModule;
import com.verlumen.strategylab.registry.CandidateRegistry;
import com.verlumen.strategylab.registry.RegistryConfig;
import com.verlumen.strategylab.registry.RegistryModule;
import com.verlumen.strategylab.registry.StoredGenome;
import com.verlumen.strategylab.scoring.FitnessProfile;
import com.verlumen.strategylab.scoring.FitnessProfileLoader;
import com.verlumen.strategylab.scoring.FitnessProfiles;
import com.verlumen.strategylab.scoring.ScoringModule;
import com.verlumen.strategylab.tuning.BacktestObjectiveFactory;
import com.verlumen.strategylab.tuning.ParameterRange;
import com.verlumen.strategylab.tuning.ParameterTuner;
import com.verlumen.strategylab.tuning.TuningModule;
import com.verlumen.strategylab.tuning.TuningResult;
import com.verlumen.strategylab.tuning.TuningSettings;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.logging.LogManager;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Command-line entry point: evolves a seed signal, optionally tuning its parameters first, then
 * runs the deployment gate on the best candidates.
 */
final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String BUNDLED_SEED = "seeds/exhaustion_signal.py";

  private final EvolutionLoop evolutionLoop;
  private final DeploymentGate gate;
  private final CandidateRegistry registry;
  private final ConcurrentEvaluator evaluator;
  private final ParameterTuner tuner;
  private final BacktestObjectiveFactory objectives;
  private final TuningSettings tuningSettings;

  @Inject
  App(
      EvolutionLoop evolutionLoop,
      DeploymentGate gate,
      CandidateRegistry registry,
      ConcurrentEvaluator evaluator,
      ParameterTuner tuner,
      BacktestObjectiveFactory objectives,
      TuningSettings tuningSettings) {
    this.evolutionLoop = evolutionLoop;
    this.gate = gate;
    this.registry = registry;
    this.evaluator = evaluator;
    this.tuner = tuner;
    this.objectives = objectives;
    this.tuningSettings = tuningSettings;
  }

  /** Returns the readiness reports of the assessed candidates, best first. */
  ImmutableList<ReadinessReport> run(
      Genome seed, EvolutionConfig config, boolean tune, int assessTop) {
    Genome base = tune ? tune(seed) : seed;
    logger.atInfo().log(
        "Evolving %s: population %d, up to %d generations",
        base.name(), config.populationSize(), config.maxGenerations());
    EvolutionResult result = evolutionLoop.run(base, config);
    for (GenerationSummary summary : result.history()) {
      logger.atInfo().log(
          "Generation %d: best %.4f, average %.4f, %d evaluated, %d failed, %d ready",
          summary.generation(),
          summary.bestFitness(),
          summary.avgFitness(),
          summary.evaluated(),
          summary.failed(),
          summary.deploymentReady());
    }
    logger.atInfo().log(
        "Evolution stopped (%s) after %d generations, best fitness %.4f",
        result.stopReason(), result.generationsCompleted(), result.bestFitness());

    ImmutableList.Builder<ReadinessReport> reports = ImmutableList.builder();
    for (StoredGenome candidate : registry.top(assessTop, 1, ImmutableSet.of())) {
      try {
        ReadinessReport report = gate.assess(candidate.currentKey());
        logger.atInfo().log(
            "%s (%s):\n%s", candidate.genome().name(), candidate.id(), report.render());
        reports.add(report);
      } catch (EvaluationException e) {
        logger.atWarning().withCause(e).log(
            "Could not assess %s for deployment", candidate.currentKey());
      }
    }
    return reports.build();
  }

  void shutdown() {
    logger.atInfo().log("Shutting down evaluator workers");
    evaluator.shutdown();
  }

  private Genome tune(Genome seed) {
    if (seed.parameters().isEmpty()) {
      logger.atInfo().log("%s has no parameters to tune", seed.name());
      return seed;
    }
    try {
      TuningResult result =
          tuner.tune(
              seed,
              ParameterRange.around(seed.parameters()),
              objectives.create(seed, evaluator.defaultMarkets().get(0)),
              tuningSettings);
      return result.applyTo(seed);
    } catch (MarketDataException e) {
      logger.atWarning().withCause(e).log("No market data for tuning, keeping seed parameters");
      return seed;
    }
  }

  public static void main(String[] args) throws IOException {
    configureLogging();
    ArgumentParser parser = createArgumentParser();
    Namespace namespace;
    try {
      namespace = parser.parseArgs(args);
    } catch (ArgumentParserException e) {
      parser.handleError(e);
      System.exit(2);
      return;
    }

    App app = Guice.createInjector(modules(namespace)).getInstance(App.class);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  logger.atInfo().log("Shutdown hook triggered");
                  app.shutdown();
                }));
    ImmutableList<ReadinessReport> reports =
        app.run(
            seed(namespace),
            evolutionConfig(namespace),
            namespace.getInt("tuneGenerations") > 0,
            namespace.getInt("assessTop"));
    long ready = reports.stream().filter(ReadinessReport::ready).count();
    logger.atInfo().log("%d of %d assessed candidates are deployable", ready, reports.size());
  }

  static ImmutableList<Module> modules(Namespace namespace) throws IOException {
    String runMode = namespace.getString("runMode");
    RegistryConfig registryConfig =
        namespace.getBoolean("inMemoryRegistry")
            ? RegistryConfig.inMemory("strategylab-" + UUID.randomUUID())
            : RegistryConfig.forFile(namespace.getString("database"));
    MarketDataConfig marketDataConfig =
        MarketDataConfig.create(
            MarketDataConfig.DEFAULT_SPOT_URL,
            MarketDataConfig.DEFAULT_FUTURES_URL,
            Duration.ofHours(namespace.getLong("cacheTtlHours")),
            Duration.ofSeconds(30),
            42L);
    GenerativeServiceConfig defaults = GenerativeServiceConfig.defaults();
    GenerativeServiceConfig generativeConfig =
        GenerativeServiceConfig.create(
            namespace.getString("endpoint"),
            namespace.getString("model"),
            namespace.getString("apiKey"),
            Duration.ofSeconds(namespace.getLong("generativeTimeoutSeconds")),
            namespace.getInt("generativeRetries"),
            defaults.sampling());
    EvaluatorConfig evaluatorConfig =
        EvaluatorConfig.create(
            namespace.getInt("workerBudget"),
            namespace.getInt("marketCap"),
            Duration.ofSeconds(namespace.getLong("executorTimeoutSeconds")),
            Duration.ofMinutes(namespace.getLong("generationTimeoutMinutes")),
            Splitter.on(' ')
                .omitEmptyStrings()
                .splitToList(namespace.getString("executorCommand")));
    DeploymentConfig deploymentConfig =
        DeploymentConfig.create(
            ValidationChecklist.defaults(),
            WalkForwardConfig.create(
                namespace.getInt("walkForwardPeriods"), namespace.getBoolean("anchored")),
            SimulationConfig.create(
                namespace.getInt("simulations"), 0.95, SimulationConfig.defaults().seed()),
            namespace.getInt("matrixLookbackDays"),
            200);
    Long randomSeed = namespace.getLong("randomSeed");
    int tuneGenerations = namespace.getInt("tuneGenerations");
    TuningSettings tuningSettings =
        tuneGenerations > 0
            ? TuningSettings.defaults().toBuilder().setGenerations(tuneGenerations).build()
            : TuningSettings.defaults();

    return ImmutableList.of(
        ExecutionModule.create(runMode),
        HttpModule.create(),
        RegistryModule.create(registryConfig),
        MarketDataModule.create(marketDataConfig),
        MutationModule.create(generativeConfig),
        EvaluationModule.create(evaluatorConfig),
        ScoringModule.create(profile(namespace)),
        EvolutionModule.create(
            randomSeed == null ? OptionalLong.empty() : OptionalLong.of(randomSeed)),
        DeploymentModule.create(deploymentConfig),
        TuningModule.create(tuningSettings));
  }

  static EvolutionConfig evolutionConfig(Namespace namespace) {
    return EvolutionConfig.builder()
        .setPopulationSize(namespace.getInt("populationSize"))
        .setMaxGenerations(namespace.getInt("generations"))
        .setEliteSize(namespace.getInt("eliteSize"))
        .setMutationRate(namespace.getDouble("mutationRate"))
        .setVariantsPerIndividual(namespace.getInt("variantsPerIndividual"))
        .setPatience(namespace.getInt("patience"))
        .setGenerationTimeout(Duration.ofMinutes(namespace.getLong("generationTimeoutMinutes")))
        .build();
  }

  static Genome seed(Namespace namespace) throws IOException {
    String seedFile = namespace.getString("seedFile");
    String source =
        seedFile == null
            ? Resources.toString(Resources.getResource(BUNDLED_SEED), StandardCharsets.UTF_8)
            : Files.readString(Path.of(seedFile), StandardCharsets.UTF_8);
    return Genome.builder()
        .setName(namespace.getString("seedName"))
        .setDescription("Seed signal")
        .setSource(source)
        .setParameters(parseParameters(namespace.getString("seedParameters")))
        .build();
  }

  /** Parses {@code name=value} pairs separated by commas. */
  static ImmutableMap<String, Double> parseParameters(String text) {
    return Splitter.on(',')
        .trimResults()
        .omitEmptyStrings()
        .withKeyValueSeparator(Splitter.on('=').trimResults())
        .split(text)
        .entrySet()
        .stream()
        .collect(toImmutableMap(Map.Entry::getKey, entry -> Double.parseDouble(entry.getValue())));
  }

  private static FitnessProfile profile(Namespace namespace) throws IOException {
    String profileFile = namespace.getString("profileFile");
    if (profileFile != null) {
      return FitnessProfileLoader.load(Path.of(profileFile));
    }
    return FitnessProfiles.fromPreset(namespace.getString("profile"));
  }

  private static void configureLogging() {
    try (InputStream config = App.class.getResourceAsStream("/logging.properties")) {
      if (config != null) {
        LogManager.getLogManager().readConfiguration(config);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read logging configuration", e);
    }
  }

  static ArgumentParser createArgumentParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("StrategyLab")
            .build()
            .defaultHelp(true)
            .description("Evolves trading signals and gates them for deployment");

    // Run mode and storage
    parser.addArgument("--runMode")
        .choices("wet", "dry")
        .setDefault("wet")
        .help("Run mode: wet or dry");
    parser.addArgument("--database")
        .setDefault("strategylab")
        .help("Path of the registry database file, without extension");
    parser.addArgument("--inMemoryRegistry")
        .action(Arguments.storeTrue())
        .help("Keep the registry in memory for this run only");

    // Generative service
    parser.addArgument("--endpoint")
        .setDefault(GenerativeServiceConfig.DEFAULT_ENDPOINT)
        .help("Base URL of an OpenAI-compatible server");
    parser.addArgument("--model")
        .setDefault(GenerativeServiceConfig.DEFAULT_MODEL)
        .help("Model name");
    parser.addArgument("--apiKey").setDefault("").help("Bearer token for the generative service");
    parser.addArgument("--generativeTimeoutSeconds")
        .type(Long.class)
        .setDefault(60L)
        .help("Timeout of one generation request");
    parser.addArgument("--generativeRetries")
        .type(Integer.class)
        .setDefault(3)
        .help("Attempts per generation request");

    // Evaluation
    parser.addArgument("--executorCommand")
        .setDefault(String.join(" ", EvaluatorConfig.defaults().executorCommand()))
        .help("Backtest command; {script}, {data}, {parameters} and {output} are substituted");
    parser.addArgument("--workerBudget")
        .type(Integer.class)
        .setDefault(4)
        .help("Concurrent backtests across a whole generation");
    parser.addArgument("--marketCap")
        .type(Integer.class)
        .setDefault(EvaluatorConfig.defaults().marketCap())
        .help("Markets sampled per candidate");
    parser.addArgument("--executorTimeoutSeconds")
        .type(Long.class)
        .setDefault(120L)
        .help("Timeout of one backtest");
    parser.addArgument("--cacheTtlHours")
        .type(Long.class)
        .setDefault(MarketDataConfig.DEFAULT_CACHE_TTL.toHours())
        .help("How long fetched candles stay fresh");

    // Evolution
    EvolutionConfig evolution = EvolutionConfig.builder().build();
    parser.addArgument("--populationSize")
        .type(Integer.class)
        .setDefault(evolution.populationSize())
        .help("Candidates per generation");
    parser.addArgument("--generations")
        .type(Integer.class)
        .setDefault(evolution.maxGenerations())
        .help("Maximum number of generations");
    parser.addArgument("--eliteSize")
        .type(Integer.class)
        .setDefault(evolution.eliteSize())
        .help("Best candidates carried over unchanged");
    parser.addArgument("--mutationRate")
        .type(Double.class)
        .setDefault(evolution.mutationRate())
        .help("Chance that an offspring is mutated");
    parser.addArgument("--variantsPerIndividual")
        .type(Integer.class)
        .setDefault(evolution.variantsPerIndividual())
        .help("Sampling variants requested per offspring");
    parser.addArgument("--patience")
        .type(Integer.class)
        .setDefault(evolution.patience())
        .help("Generations without improvement before stopping");
    parser.addArgument("--generationTimeoutMinutes")
        .type(Long.class)
        .setDefault(evolution.generationTimeout().toMinutes())
        .help("Deadline for evaluating one generation");
    parser.addArgument("--randomSeed")
        .type(Long.class)
        .help("Fixes every random choice of the run");

    // Scoring
    parser.addArgument("--profile")
        .setDefault(FitnessProfiles.DEFAULT_PRESET)
        .help("Fitness preset, e.g. BALANCED_DEMO or CONSERVATIVE_PRODUCTION");
    parser.addArgument("--profileFile").help("JSON fitness profile; overrides --profile");

    // Seed
    parser.addArgument("--seedFile").help("Seed signal source; defaults to the bundled seed");
    parser.addArgument("--seedName")
        .setDefault("exhaustion_signal")
        .help("Name of the seed genome");
    parser.addArgument("--seedParameters")
        .setDefault("level1=9,level2=12,level3=14")
        .help("Seed parameters as name=value pairs separated by commas");

    // Tuning and deployment
    parser.addArgument("--tuneGenerations")
        .type(Integer.class)
        .setDefault(0)
        .help("Tune the seed's parameters for this many generations before evolving; 0 skips");
    parser.addArgument("--assessTop")
        .type(Integer.class)
        .setDefault(3)
        .help("Best candidates to run through the deployment gate");
    parser.addArgument("--walkForwardPeriods")
        .type(Integer.class)
        .setDefault(WalkForwardConfig.defaults().periods())
        .help("Walk-forward periods");
    parser.addArgument("--anchored")
        .action(Arguments.storeTrue())
        .help("Grow walk-forward in-sample windows from the first bar");
    parser.addArgument("--simulations")
        .type(Integer.class)
        .setDefault(SimulationConfig.defaults().simulations())
        .help("Bootstrap paths per robustness simulation");
    parser.addArgument("--matrixLookbackDays")
        .type(Integer.class)
        .setDefault(30)
        .help("Look-back of each market in the validation matrix");

    return parser;
  }
}
