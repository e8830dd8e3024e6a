package com.flamingo.ai.olivia.service.rag.retrieval;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Builds lexical variants of short queries from a fixed synonym table. */
@Component
@Slf4j
public class QueryExpander {

  private static final int MAX_EXPANDABLE_WORDS = 4;
  private static final int MAX_VARIANTS = 4;

  private static final Map<String, List<String>> SYNONYMS =
      Map.of(
          "show", List.of("display", "present"),
          "create", List.of("build", "develop"),
          "explain", List.of("describe", "clarify"),
          "find", List.of("locate", "search"),
          "help", List.of("assist", "support"),
          "use", List.of("utilize", "apply"),
          "work", List.of("function", "operate"),
          "problem", List.of("issue", "difficulty"),
          "solution", List.of("answer", "fix"),
          "example", List.of("instance", "sample"));

  /**
   * Returns the original query followed by up to three distinct variants.
   *
   * <p>Queries of one word, or of more than four words, come back unexpanded.
   */
  public List<String> expand(String query) {
    if (query == null || QueryComplexityAnalyzer.wordCount(query) < 2) {
      return query == null ? List.of() : List.of(query);
    }
    String[] words = query.strip().toLowerCase(Locale.ROOT).split("\\s+");
    if (words.length > MAX_EXPANDABLE_WORDS) {
      return List.of(query);
    }

    List<List<String>> choices = new ArrayList<>(words.length);
    for (String word : words) {
      List<String> options = new ArrayList<>();
      options.add(word);
      options.addAll(SYNONYMS.getOrDefault(word, List.of()));
      choices.add(options);
    }

    String original = query.strip().toLowerCase(Locale.ROOT);
    Set<String> variants = new LinkedHashSet<>();
    variants.add(query);
    collect(choices, 0, new ArrayList<>(), original, variants);

    List<String> result = new ArrayList<>(variants);
    log.debug("Query expansion: '{}' -> {}", query, result);
    return result;
  }

  private void collect(
      List<List<String>> choices,
      int position,
      List<String> prefix,
      String original,
      Set<String> variants) {
    if (variants.size() >= MAX_VARIANTS) {
      return;
    }
    if (position == choices.size()) {
      String candidate = String.join(" ", prefix);
      if (!candidate.equals(original)) {
        variants.add(candidate);
      }
      return;
    }
    for (String option : choices.get(position)) {
      prefix.add(option);
      collect(choices, position + 1, prefix, original, variants);
      prefix.remove(prefix.size() - 1);
      if (variants.size() >= MAX_VARIANTS) {
        return;
      }
    }
  }
}
