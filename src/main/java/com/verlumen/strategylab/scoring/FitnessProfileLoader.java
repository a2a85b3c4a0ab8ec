package com.verlumen.strategylab.scoring;

import com.google.common.collect.ImmutableMap;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes fitness profiles as JSON:
 *
 * <pre>{@code
 * {"name": "...", "weights": {"pnl": 0.25, ...},
 *  "thresholds": {"min_fitness": 0.2, ...}, "normalization": {"pnl_max": 1000, ...}}
 * }</pre>
 *
 * Missing threshold or normalization sections fall back to DEMO and the default ranges.
 */
public final class FitnessProfileLoader {
  private static final Gson GSON =
      new GsonBuilder()
          .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
          .setPrettyPrinting()
          .create();

  public static FitnessProfile load(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return fromJson(reader);
    }
  }

  public static FitnessProfile fromJson(Reader reader) throws IOException {
    ProfileFile file;
    try {
      file = GSON.fromJson(reader, ProfileFile.class);
    } catch (JsonParseException e) {
      throw new IOException("Malformed fitness profile", e);
    }
    if (file == null || file.name == null || file.weights == null) {
      throw new IOException("Fitness profile requires a name and weights");
    }

    Map<Criterion, Double> weights = new LinkedHashMap<>();
    file.weights.forEach((key, weight) -> weights.put(Criterion.fromKey(key), weight));
    DeploymentThresholds thresholds =
        file.thresholds == null ? DeploymentThresholds.DEMO : file.thresholds.toThresholds();
    NormalizationRanges normalization =
        file.normalization == null
            ? NormalizationRanges.DEFAULT
            : file.normalization.toRanges();
    return FitnessProfile.create(file.name, weights, thresholds, normalization);
  }

  public static void save(FitnessProfile profile, Path path) throws IOException {
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      GSON.toJson(ProfileFile.of(profile), writer);
    }
  }

  private static final class ProfileFile {
    String name;
    Map<String, Double> weights;
    ThresholdsSection thresholds;
    NormalizationSection normalization;

    static ProfileFile of(FitnessProfile profile) {
      ProfileFile file = new ProfileFile();
      file.name = profile.name();
      ImmutableMap.Builder<String, Double> weights = ImmutableMap.builder();
      profile.weights().forEach((criterion, weight) -> weights.put(criterion.key(), weight));
      file.weights = weights.buildOrThrow();
      file.thresholds = ThresholdsSection.of(profile.thresholds());
      file.normalization = NormalizationSection.of(profile.normalization());
      return file;
    }
  }

  private static final class ThresholdsSection {
    String name = "CUSTOM";
    double minFitness;
    double minSharpeRatio;
    double minWinRate;
    double maxDrawdown;
    double minTradesPerMarket;
    int minMarketsTested;
    double maxSlippage;
    double maxExecutionDelayMs;
    double maxMarketImpact;
    int minTotalTrades;

    static ThresholdsSection of(DeploymentThresholds thresholds) {
      ThresholdsSection section = new ThresholdsSection();
      section.name = thresholds.name();
      section.minFitness = thresholds.minFitness();
      section.minSharpeRatio = thresholds.minSharpeRatio();
      section.minWinRate = thresholds.minWinRate();
      section.maxDrawdown = thresholds.maxDrawdown();
      section.minTradesPerMarket = thresholds.minTradesPerMarket();
      section.minMarketsTested = thresholds.minMarketsTested();
      section.maxSlippage = thresholds.maxSlippage();
      section.maxExecutionDelayMs = thresholds.maxExecutionDelayMs();
      section.maxMarketImpact = thresholds.maxMarketImpact();
      section.minTotalTrades = thresholds.minTotalTrades();
      return section;
    }

    DeploymentThresholds toThresholds() {
      return DeploymentThresholds.builder()
          .setName(name)
          .setMinFitness(minFitness)
          .setMinSharpeRatio(minSharpeRatio)
          .setMinWinRate(minWinRate)
          .setMaxDrawdown(maxDrawdown)
          .setMinTradesPerMarket(minTradesPerMarket)
          .setMinMarketsTested(minMarketsTested)
          .setMaxSlippage(maxSlippage)
          .setMaxExecutionDelayMs(maxExecutionDelayMs)
          .setMaxMarketImpact(maxMarketImpact)
          .setMinTotalTrades(minTotalTrades)
          .build();
    }
  }

  private static final class NormalizationSection {
    double pnlMax = NormalizationRanges.DEFAULT.pnlMax();
    double sharpeMax = NormalizationRanges.DEFAULT.sharpeMax();
    double tradeFrequencyMax = NormalizationRanges.DEFAULT.tradeFrequencyMax();
    double slippageTolerance = NormalizationRanges.DEFAULT.slippageTolerance();
    double executionDelayMaxMs = NormalizationRanges.DEFAULT.executionDelayMaxMs();
    int diversityTarget = NormalizationRanges.DEFAULT.diversityTarget();

    static NormalizationSection of(NormalizationRanges ranges) {
      NormalizationSection section = new NormalizationSection();
      section.pnlMax = ranges.pnlMax();
      section.sharpeMax = ranges.sharpeMax();
      section.tradeFrequencyMax = ranges.tradeFrequencyMax();
      section.slippageTolerance = ranges.slippageTolerance();
      section.executionDelayMaxMs = ranges.executionDelayMaxMs();
      section.diversityTarget = ranges.diversityTarget();
      return section;
    }

    NormalizationRanges toRanges() {
      return NormalizationRanges.create(
          pnlMax,
          sharpeMax,
          tradeFrequencyMax,
          slippageTolerance,
          executionDelayMaxMs,
          diversityTarget);
    }
  }

  private FitnessProfileLoader() {}
}
