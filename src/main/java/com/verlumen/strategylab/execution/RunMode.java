package com.verlumen.strategylab.execution;

import java.util.Locale;

/** WET talks to real services; DRY swaps every external collaborator for an offline one. */
public enum RunMode {
  WET,
  DRY;

  public static RunMode fromString(String name) {
    return RunMode.valueOf(name.toUpperCase(Locale.ROOT));
  }
}
