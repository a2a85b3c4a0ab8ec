package com.verlumen.strategylab.mutation;

import com.google.common.collect.ImmutableSortedMap;
import com.google.inject.Inject;
import com.verlumen.strategylab.genome.Genome;
import java.util.Map;

/** Builds the prompts sent to the generative service. */
final class PromptBuilder {
  private static final String SYSTEM_PROMPT =
      String.join(
          "\n",
          "You modify trading-signal programs written for the PyneCore runtime.",
          "Return exactly one complete program in a single ```python code block.",
          "The program must keep the \"\"\"@pyne\"\"\" marker, an @script.indicator or",
          "@script.strategy decorator and a def main() function.",
          "Use the PyneCore series API (close.sma(), close.ema(), close[1]).",
          "Never use Pine Script namespaces such as ta., strategy., request. or varip.",
          "Never import os, subprocess or socket, and never call eval, exec or open.");

  @Inject
  PromptBuilder() {}

  String systemPrompt() {
    return SYSTEM_PROMPT;
  }

  String userPrompt(Genome parent, MutationKind kind) {
    StringBuilder prompt = new StringBuilder();
    prompt.append("Mutation: ").append(kind.label()).append('\n');
    prompt.append(kind.instruction()).append('\n');
    prompt.append(guidance(kind)).append("\n\n");
    prompt.append("Generation: ").append(parent.generation()).append('\n');
    if (!parent.parameters().isEmpty()) {
      prompt.append("Current parameters:\n");
      for (Map.Entry<String, Double> parameter :
          ImmutableSortedMap.copyOf(parent.parameters()).entrySet()) {
        prompt.append("- ").append(parameter.getKey()).append(" = ");
        prompt.append(parameter.getValue()).append('\n');
      }
    }
    prompt.append("\nCurrent program:\n```python\n").append(parent.source()).append("\n```\n");
    return prompt.toString();
  }

  /** Re-asks with the problems found in the previous answer. */
  String correctivePrompt(String userPrompt, String problems) {
    return userPrompt
        + "\nYour previous answer was rejected:\n"
        + problems
        + "\nFix these problems and return the complete program again.";
  }

  private static String guidance(MutationKind kind) {
    switch (kind) {
      case PARAMETER:
        return "Adjust thresholds and periods by small amounts; keep the structure identical.";
      case LOGIC:
        return "Rework how bars are compared, e.g. which past closes the signal counts against.";
      case INDICATOR_SWAP:
        return "Swap a moving average or oscillator for a comparable one (sma, ema, rsi).";
      case TIMEFRAME:
        return "Change look-back lengths so the signal reacts faster or slower.";
      case RISK:
        return "Reduce exposure: tighter stops, smaller sizes, or stricter confirmation.";
    }
    throw new AssertionError(kind);
  }
}
