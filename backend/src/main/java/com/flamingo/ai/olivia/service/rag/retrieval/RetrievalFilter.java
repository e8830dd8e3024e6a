package com.flamingo.ai.olivia.service.rag.retrieval;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Turns raw retrieval hits into a ranked document list, a citation list and a generation context.
 *
 * <p>Content identity is approximated by the first 100 trimmed characters, so two chunks sharing
 * an opening collapse into one even if their tails differ.
 */
@Component
public class RetrievalFilter {

  static final int DEDUP_PREFIX_LENGTH = 100;
  static final int PREVIEW_LENGTH = 500;

  private static final Comparator<RetrievedDocument> BY_SCORE_DESC =
      Comparator.comparingDouble(RetrievedDocument::score).reversed();

  /** Drops hits below {@code minScore} and content duplicates, then sorts by score, stably. */
  public List<RetrievedDocument> dedupAndFilter(
      Collection<RetrievedDocument> documents, double minScore) {
    Set<String> seen = new HashSet<>();
    List<RetrievedDocument> kept = new ArrayList<>();
    for (RetrievedDocument document : documents) {
      if (document.score() < minScore) {
        continue;
      }
      if (seen.add(dedupKey(document.content()))) {
        kept.add(document);
      }
    }
    // List.sort is a stable merge sort
    kept.sort(BY_SCORE_DESC);
    return kept;
  }

  /** One citation per source, carrying the highest-scoring chunk of that source. */
  public List<SourceCitation> toCitations(List<RetrievedDocument> documents) {
    Map<String, SourceCitation> bySource = new LinkedHashMap<>();
    for (RetrievedDocument document : documents) {
      String source = document.source() != null ? document.source() : "Unknown";
      SourceCitation current = bySource.get(source);
      if (current == null || document.score() > current.similarityScore()) {
        bySource.put(
            source, new SourceCitation(source, document.score(), preview(document.content())));
      }
    }
    return new ArrayList<>(bySource.values());
  }

  public List<SourceCitation> rankAndCap(
      List<SourceCitation> citations, double minScore, int topK) {
    return citations.stream()
        .filter(citation -> citation.similarityScore() >= minScore)
        .sorted(Comparator.comparingDouble(SourceCitation::similarityScore).reversed())
        .limit(Math.max(topK, 0))
        .collect(Collectors.toList());
  }

  /**
   * Joins documents into {@code [Source: name]} blocks separated by blank lines. No documents
   * yields an empty string.
   */
  public String toContext(List<RetrievedDocument> documents) {
    return documents.stream()
        .map(
            document ->
                "[Source: "
                    + (document.source() != null ? document.source() : "Unknown")
                    + "]\n"
                    + document.content())
        .collect(Collectors.joining("\n\n"));
  }

  private static String dedupKey(String content) {
    String text = content != null ? content : "";
    return text.substring(0, Math.min(DEDUP_PREFIX_LENGTH, text.length())).strip();
  }

  private static String preview(String content) {
    if (content == null) {
      return "";
    }
    return content.length() > PREVIEW_LENGTH ? content.substring(0, PREVIEW_LENGTH) : content;
  }
}
