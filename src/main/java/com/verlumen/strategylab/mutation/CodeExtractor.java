package com.verlumen.strategylab.mutation;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Pulls the first fenced code block out of a generated response. */
final class CodeExtractor {
  private static final Pattern TAGGED_BLOCK =
      Pattern.compile("```(?:python|py)[ \\t]*\\r?\\n(.*?)```", Pattern.DOTALL);
  private static final Pattern ANY_BLOCK =
      Pattern.compile("```[^\\n`]*\\r?\\n(.*?)```", Pattern.DOTALL);

  static Optional<String> extract(String text) {
    Optional<String> tagged = firstMatch(TAGGED_BLOCK, text);
    return tagged.isPresent() ? tagged : firstMatch(ANY_BLOCK, text);
  }

  private static Optional<String> firstMatch(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      String code = matcher.group(1).strip();
      if (!code.isEmpty()) {
        return Optional.of(code);
      }
    }
    return Optional.empty();
  }

  private CodeExtractor() {}
}
