package com.verlumen.strategylab.mutation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.inject.Inject;
import com.verlumen.strategylab.genome.Genome;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local, total mutation used whenever the generative path gives up. Given the same random state it
 * always produces the same result, and it never throws for a well-formed genome.
 */
final class FallbackMutator {
  private static final double PARAMETER_MUTATION_RATE = 0.3;
  private static final int INTEGER_STEP = 2;
  private static final double MIN_SCALE = 0.8;
  private static final double MAX_SCALE = 1.2;
  private static final double RISK_SHRINK = 0.8;
  private static final ImmutableList<String> RISK_MARKERS =
      ImmutableList.of("stop", "risk", "size", "loss", "profit");
  private static final Pattern INTEGER_LITERAL = Pattern.compile("(?<![\\w.])(\\d+)(?![\\w.])");
  private static final String SWAP_PLACEHOLDER = "\u0000SWAP\u0000";

  @Inject
  FallbackMutator() {}

  Variation mutate(Genome parent, MutationKind kind, Random random) {
    switch (kind) {
      case PARAMETER:
        return Variation.create(parent.source(), jitter(parent.parameters(), random));
      case LOGIC:
        return Variation.create(
            parent.source().replace("close[4]", "close[3]").replace("close[2]", "close[1]"),
            parent.parameters());
      case INDICATOR_SWAP:
        return Variation.create(
            parent
                .source()
                .replace(".sma(", SWAP_PLACEHOLDER)
                .replace(".ema(", ".sma(")
                .replace(SWAP_PLACEHOLDER, ".ema("),
            parent.parameters());
      case TIMEFRAME:
        return Variation.create(shortenLookbacks(parent.source()), parent.parameters());
      case RISK:
        return Variation.create(parent.source(), shrinkRisk(parent.parameters()));
    }
    throw new AssertionError(kind);
  }

  private static Map<String, Double> jitter(Map<String, Double> parameters, Random random) {
    // Sorted so the random draws do not depend on map iteration order.
    ImmutableSortedMap<String, Double> sorted = ImmutableSortedMap.copyOf(parameters);
    if (sorted.isEmpty()) {
      return sorted;
    }
    Map<String, Double> mutated = new LinkedHashMap<>(sorted);
    boolean touched = false;
    for (String key : sorted.keySet()) {
      if (random.nextDouble() < PARAMETER_MUTATION_RATE) {
        mutated.put(key, perturb(sorted.get(key), random));
        touched = true;
      }
    }
    if (!touched) {
      String key = sorted.keySet().asList().get(random.nextInt(sorted.size()));
      mutated.put(key, perturb(sorted.get(key), random));
    }
    return mutated;
  }

  private static double perturb(double value, Random random) {
    if (value == Math.rint(value)) {
      int step = random.nextInt(2 * INTEGER_STEP + 1) - INTEGER_STEP;
      return Math.max(1.0, value + step);
    }
    return value * (MIN_SCALE + (MAX_SCALE - MIN_SCALE) * random.nextDouble());
  }

  private static String shortenLookbacks(String source) {
    Matcher matcher = INTEGER_LITERAL.matcher(source);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      // Literals may exceed the range of a long.
      BigInteger value = new BigInteger(matcher.group(1));
      String replacement =
          value.compareTo(BigInteger.ONE) > 0
              ? value.subtract(BigInteger.ONE).toString()
              : matcher.group(1);
      matcher.appendReplacement(result, replacement);
    }
    matcher.appendTail(result);
    return result.toString();
  }

  private static Map<String, Double> shrinkRisk(Map<String, Double> parameters) {
    Map<String, Double> mutated = new LinkedHashMap<>(parameters);
    parameters.forEach(
        (key, value) -> {
          if (isRiskParameter(key)) {
            mutated.put(key, value * RISK_SHRINK);
          }
        });
    return mutated;
  }

  private static boolean isRiskParameter(String key) {
    String lower = key.toLowerCase(Locale.ROOT);
    return RISK_MARKERS.stream().anyMatch(lower::contains);
  }
}
