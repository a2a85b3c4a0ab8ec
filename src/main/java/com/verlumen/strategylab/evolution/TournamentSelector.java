package com.verlumen.strategylab.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.inject.Inject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Tournament selection over the top half of a ranking. The tournament size is {@code min(4,
 * half)}; the best-ranked entrant wins.
 */
final class TournamentSelector {
  private static final int MAX_TOURNAMENT_SIZE = 4;

  private final Random random;

  @Inject
  TournamentSelector(Random random) {
    this.random = random;
  }

  /** @param ranked candidates sorted best first; must not be empty */
  ScoredCandidate select(List<ScoredCandidate> ranked) {
    checkArgument(!ranked.isEmpty(), "Cannot select from an empty ranking");
    int half = Math.max(1, ranked.size() / 2);
    int size = Math.max(1, Math.min(MAX_TOURNAMENT_SIZE, ranked.size() / 2));
    List<Integer> entrants = new ArrayList<>();
    for (int i = 0; i < half; i++) {
      entrants.add(i);
    }
    synchronized (random) {
      Collections.shuffle(entrants, random);
    }
    int winner = Collections.min(entrants.subList(0, size));
    return ranked.get(winner);
  }
}
