package com.flamingo.ai.olivia.service.rag.retrieval;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Classifies queries by wording and length and derives retrieval parameters from the class.
 *
 * <p>The derived parameters are advisory. Callers clamp them to the configured ceiling and floor.
 */
@Component
@Slf4j
public class QueryComplexityAnalyzer {

  private static final int SIMPLE_MAX_WORDS = 3;
  private static final int MODERATE_MAX_WORDS = 9;

  private static final List<Pattern> COMPLEX_PATTERNS =
      List.of(
          Pattern.compile("\\b(how|why|explain|compare|analyze|describe)\\b.*\\?"),
          // a comparison is complex wherever the question mark falls
          Pattern.compile("(?s)(?=.*\\bcompare\\b)(?=.*\\?)"),
          Pattern.compile("\\b(what|which|when|where)\\b.*\\b(and|or|versus|vs|but)\\b"),
          Pattern.compile("\\b(multiple|several|different|various)\\b"),
          Pattern.compile("\\b(steps|process|procedure|method)\\b"),
          Pattern.compile("[0-9]+\\s+(ways|types|examples|steps)"));

  public QueryComplexity classify(String query) {
    String normalized = query.strip();
    String lower = normalized.toLowerCase(Locale.ROOT);
    for (Pattern pattern : COMPLEX_PATTERNS) {
      if (pattern.matcher(lower).find()) {
        return QueryComplexity.COMPLEX;
      }
    }

    int words = wordCount(normalized);
    if (words <= SIMPLE_MAX_WORDS) {
      return QueryComplexity.SIMPLE;
    }
    return words <= MODERATE_MAX_WORDS ? QueryComplexity.MODERATE : QueryComplexity.COMPLEX;
  }

  public RetrievalParams getOptimalParams(String query, int baseTopK, double baseMinScore) {
    QueryComplexity complexity = classify(query);
    RetrievalParams params =
        switch (complexity) {
          case SIMPLE ->
              new RetrievalParams(
                  Math.min(baseTopK, 10),
                  Math.max(baseMinScore, 0.25),
                  false,
                  complexity,
                  "Simple query - using focused retrieval with quality threshold");
          case MODERATE ->
              new RetrievalParams(
                  baseTopK,
                  baseMinScore,
                  false,
                  complexity,
                  "Moderate complexity - using standard retrieval parameters");
          case COMPLEX ->
              new RetrievalParams(
                  Math.max(baseTopK, 8),
                  Math.max(baseMinScore, 0.10),
                  true,
                  complexity,
                  "Complex query - expanding retrieval scope for comprehensive context");
        };
    log.debug("Query classified as {}: {}", complexity.getValue(), params.reasoning());
    return params;
  }

  static int wordCount(String text) {
    String stripped = text.strip();
    return stripped.isEmpty() ? 0 : stripped.split("\\s+").length;
  }
}
