package com.verlumen.strategylab.genome;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.hash.Hashing;
import com.google.gson.Gson;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/** Stable content hash used to detect no-op mutations. */
public final class CommitHashes {
  private static final Gson GSON = new Gson();
  private static final int HASH_LENGTH = 12;

  public static String of(String source, Map<String, Double> parameters) {
    String content = source + GSON.toJson(ImmutableSortedMap.copyOf(parameters));
    return Hashing.sha256()
        .hashString(content, StandardCharsets.UTF_8)
        .toString()
        .substring(0, HASH_LENGTH);
  }

  private CommitHashes() {}
}
