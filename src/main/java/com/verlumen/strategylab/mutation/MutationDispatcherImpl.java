package com.verlumen.strategylab.mutation;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.strategylab.genome.Genome;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

final class MutationDispatcherImpl implements MutationDispatcher {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final double TEMPERATURE_DECAY = 0.8;
  private static final Pattern LINEAGE_SUFFIX = Pattern.compile("(_[a-z]+_g\\d+)+$");

  private final GenerativeService generativeService;
  private final GenerativeServiceConfig config;
  private final PromptBuilder promptBuilder;
  private final SourceValidator validator;
  private final FallbackMutator fallbackMutator;
  private final Random random;

  private final AtomicInteger requested = new AtomicInteger();
  private final AtomicInteger generative = new AtomicInteger();
  private final AtomicInteger fallback = new AtomicInteger();
  private final AtomicInteger retries = new AtomicInteger();
  private final AtomicInteger rejectedByValidation = new AtomicInteger();

  @Inject
  MutationDispatcherImpl(
      GenerativeService generativeService,
      GenerativeServiceConfig config,
      PromptBuilder promptBuilder,
      SourceValidator validator,
      FallbackMutator fallbackMutator,
      Random random) {
    this.generativeService = generativeService;
    this.config = config;
    this.promptBuilder = promptBuilder;
    this.validator = validator;
    this.fallbackMutator = fallbackMutator;
    this.random = random;
  }

  @Override
  public Genome mutate(Genome parent, MutationKind kind) {
    requested.incrementAndGet();
    Optional<String> generated = generate(parent, kind);
    Variation variation;
    String note;
    if (generated.isPresent()) {
      generative.incrementAndGet();
      variation = Variation.create(generated.get(), parent.parameters());
      note = "generative " + kind.label() + " mutation";
    } else {
      fallback.incrementAndGet();
      synchronized (random) {
        variation = fallbackMutator.mutate(parent, kind, random);
      }
      note = "fallback " + kind.label() + " mutation";
    }
    logger.atFine().log("Mutated %s via %s", parent.name(), note);
    return child(parent, kind, variation, note);
  }

  @Override
  public MutationStats stats() {
    return MutationStats.create(
        requested.get(),
        generative.get(),
        fallback.get(),
        retries.get(),
        rejectedByValidation.get());
  }

  private Optional<String> generate(Genome parent, MutationKind kind) {
    String basePrompt = promptBuilder.userPrompt(parent, kind);
    String prompt = basePrompt;
    SamplingParams sampling = config.sampling();
    for (int attempt = 1; attempt <= config.maxRetries(); attempt++) {
      if (attempt > 1) {
        retries.incrementAndGet();
      }
      GenerationResult result;
      try {
        result = generativeService.generate(promptBuilder.systemPrompt(), prompt, sampling);
      } catch (RuntimeException e) {
        logger.atWarning().withCause(e).log(
            "Generative service error on attempt %d for %s", attempt, parent.name());
        result = GenerationResult.failure("Generative service error: " + e.getMessage(), true);
      }
      if (!result.success()) {
        logger.atInfo().log(
            "Generation attempt %d/%d for %s failed: %s",
            attempt, config.maxRetries(), parent.name(), result.error().orElse("unknown"));
        if (!result.retryable()) {
          return Optional.empty();
        }
      } else {
        Optional<String> code = CodeExtractor.extract(result.text());
        if (code.isEmpty()) {
          logger.atInfo().log("Attempt %d for %s returned no code block", attempt, parent.name());
          prompt =
              promptBuilder.correctivePrompt(
                  basePrompt, "The answer did not contain a fenced code block.");
        } else {
          ValidationReport report = validator.validate(code.get());
          if (report.valid()) {
            return code;
          }
          rejectedByValidation.incrementAndGet();
          logger.atInfo().log(
              "Attempt %d for %s failed validation:\n%s", attempt, parent.name(), report.summary());
          prompt = promptBuilder.correctivePrompt(basePrompt, report.summary());
        }
      }
      sampling = sampling.withTemperature(sampling.temperature() * TEMPERATURE_DECAY);
    }
    return Optional.empty();
  }

  private static Genome child(Genome parent, MutationKind kind, Variation variation, String note) {
    int generation = parent.generation() + 1;
    String root = LINEAGE_SUFFIX.matcher(parent.name()).replaceFirst("");
    return Genome.builder()
        .setName(root + "_" + kind.label() + "_g" + generation)
        .setDescription(note)
        .setSource(variation.source())
        .setParameters(variation.parameters())
        .setGeneration(generation)
        .setParentIds(
            ImmutableList.<String>builder()
                .addAll(parent.parentIds())
                .add(parent.lineageId())
                .build())
        .setFitness(0.0)
        .build();
  }
}
