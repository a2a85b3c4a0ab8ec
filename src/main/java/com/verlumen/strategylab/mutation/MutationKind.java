package com.verlumen.strategylab.mutation;

/** The closed set of mutation intents the dispatcher understands. */
public enum MutationKind {
  PARAMETER("parameter", "Tune the numeric parameters without changing the signal logic."),
  LOGIC("logic", "Change the entry or exit conditions while keeping the indicators."),
  INDICATOR_SWAP("indicator", "Replace one indicator with a comparable one."),
  TIMEFRAME("timeframe", "Shorten or lengthen the look-back windows the signal relies on."),
  RISK("risk", "Tighten risk handling: smaller positions, closer stops, earlier exits.");

  private final String label;
  private final String instruction;

  MutationKind(String label, String instruction) {
    this.label = label;
    this.instruction = instruction;
  }

  public String label() {
    return label;
  }

  String instruction() {
    return instruction;
  }
}
