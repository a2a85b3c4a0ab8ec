package com.verlumen.strategylab.mutation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import com.verlumen.strategylab.mutation.ValidationIssue.Category;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Static checks on generated signal programs: balanced delimiters and string literals, the
 * required script markers, and no calls into incompatible or unsafe APIs.
 */
final class SourceValidator {
  private static final ImmutableList<String> REQUIRED_MARKERS =
      ImmutableList.of("@pyne", "@script.");
  private static final Pattern MAIN_FUNCTION =
      Pattern.compile("^def\\s+main\\s*\\(", Pattern.MULTILINE);
  private static final String RECOMMENDED_IMPORT = "from pynecore";

  private static final ImmutableMap<Pattern, String> INCOMPATIBLE_APIS =
      ImmutableMap.of(
          Pattern.compile("\\bta\\."), "ta.",
          Pattern.compile("(?<![\\w.])strategy\\."), "strategy.",
          Pattern.compile("\\brequest\\."), "request.",
          Pattern.compile("\\bvarip\\b"), "varip");

  private static final ImmutableMap<Pattern, String> UNSAFE_CALLS =
      ImmutableMap.of(
          Pattern.compile("^\\s*(import|from)\\s+(os|subprocess|socket|shutil)\\b"),
              "system module import",
          Pattern.compile("\\bsubprocess\\."), "subprocess call",
          Pattern.compile("(?<![\\w.])eval\\s*\\("), "eval()",
          Pattern.compile("(?<![\\w.])exec\\s*\\("), "exec()",
          Pattern.compile("__import__"), "__import__",
          Pattern.compile("(?<![\\w.])open\\s*\\("), "open()");

  private static final ImmutableMap<Character, Character> CLOSERS =
      ImmutableMap.of(')', '(', ']', '[', '}', '{');

  @Inject
  SourceValidator() {}

  ValidationReport validate(String source) {
    ImmutableList.Builder<ValidationIssue> issues = ImmutableList.builder();
    checkSyntax(source, issues);
    checkStructure(source, issues);
    checkApis(source, issues);
    return ValidationReport.create(issues.build());
  }

  private static void checkSyntax(String source, ImmutableList.Builder<ValidationIssue> issues) {
    if (source.isBlank()) {
      issues.add(ValidationIssue.error(Category.SYNTAX, 0, "Source is empty"));
      return;
    }

    Deque<int[]> open = new ArrayDeque<>();
    int line = 1;
    int i = 0;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (c == '\n') {
        line++;
        i++;
      } else if (c == '#') {
        while (i < source.length() && source.charAt(i) != '\n') {
          i++;
        }
      } else if (c == '"' || c == '\'') {
        boolean triple = source.startsWith(String.valueOf(c).repeat(3), i);
        String delimiter = triple ? String.valueOf(c).repeat(3) : String.valueOf(c);
        int startLine = line;
        int end = findStringEnd(source, i + delimiter.length(), delimiter, triple);
        if (end < 0) {
          issues.add(
              ValidationIssue.error(Category.SYNTAX, startLine, "Unterminated string literal"));
          return;
        }
        for (int j = i; j < end; j++) {
          if (source.charAt(j) == '\n') {
            line++;
          }
        }
        i = end;
      } else if (c == '(' || c == '[' || c == '{') {
        open.push(new int[] {c, line});
        i++;
      } else if (CLOSERS.containsKey(c)) {
        if (open.isEmpty() || open.peek()[0] != CLOSERS.get(c)) {
          issues.add(ValidationIssue.error(Category.SYNTAX, line, "Unmatched '" + c + "'"));
          return;
        }
        open.pop();
        i++;
      } else {
        i++;
      }
    }
    if (!open.isEmpty()) {
      int[] unclosed = open.peek();
      issues.add(
          ValidationIssue.error(
              Category.SYNTAX, unclosed[1], "Unclosed '" + (char) unclosed[0] + "'"));
    }
  }

  /** Index just past the closing delimiter, or -1. */
  private static int findStringEnd(String source, int from, String delimiter, boolean triple) {
    int i = from;
    while (i < source.length()) {
      char c = source.charAt(i);
      if (c == '\\') {
        i += 2;
      } else if (!triple && c == '\n') {
        return -1;
      } else if (source.startsWith(delimiter, i)) {
        return i + delimiter.length();
      } else {
        i++;
      }
    }
    return -1;
  }

  private static void checkStructure(
      String source, ImmutableList.Builder<ValidationIssue> issues) {
    for (String marker : REQUIRED_MARKERS) {
      if (!source.contains(marker)) {
        issues.add(ValidationIssue.error(Category.STRUCTURE, 0, "Missing " + marker));
      }
    }
    if (!MAIN_FUNCTION.matcher(source).find()) {
      issues.add(ValidationIssue.error(Category.STRUCTURE, 0, "Missing def main()"));
    }
    if (!source.contains(RECOMMENDED_IMPORT)) {
      issues.add(
          ValidationIssue.warning(Category.STRUCTURE, 0, "No explicit pynecore import found"));
    }
  }

  private static void checkApis(String source, ImmutableList.Builder<ValidationIssue> issues) {
    List<String> lines = source.lines().collect(ImmutableList.toImmutableList());
    for (int i = 0; i < lines.size(); i++) {
      String code = stripComment(lines.get(i));
      for (Map.Entry<Pattern, String> api : INCOMPATIBLE_APIS.entrySet()) {
        if (api.getKey().matcher(code).find()) {
          issues.add(
              ValidationIssue.error(
                  Category.API, i + 1, "Incompatible API pattern: " + api.getValue()));
        }
      }
      for (Map.Entry<Pattern, String> unsafe : UNSAFE_CALLS.entrySet()) {
        if (unsafe.getKey().matcher(code).find()) {
          issues.add(
              ValidationIssue.error(Category.SAFETY, i + 1, "Unsafe call: " + unsafe.getValue()));
        }
      }
    }
  }

  private static String stripComment(String line) {
    int hash = line.indexOf('#');
    return hash < 0 ? line : line.substring(0, hash);
  }
}
