package com.flamingo.ai.olivia.service.ingestion;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Splits text into chunks of at most {@code chunkSize} characters, preferring paragraph breaks,
 * then line breaks, then spaces, and cutting between characters only as a last resort.
 *
 * <p>Separators stay attached to the start of the piece that follows them, so chunks can be
 * located in the source text again. Consecutive chunks share up to {@code overlap} characters.
 * Instances are immutable and thread-safe.
 */
@Getter
@Slf4j
public class RecursiveTextSplitter {

  private static final List<String> SEPARATORS = List.of("\n\n", "\n", " ", "");

  private final int chunkSize;
  private final int overlap;

  public RecursiveTextSplitter(int chunkSize, int overlap) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    if (overlap < 0 || overlap >= chunkSize) {
      throw new IllegalArgumentException(
          "overlap must be in [0, chunkSize): " + overlap + " vs " + chunkSize);
    }
    this.chunkSize = chunkSize;
    this.overlap = overlap;
  }

  /** Chunks every page, recording where each chunk starts within its page. */
  public List<TextChunk> split(List<LoadedPage> pages) {
    List<TextChunk> chunks = new ArrayList<>();
    for (LoadedPage page : pages) {
      String text = page.text();
      int index = 0;
      int previousLength = 0;
      for (String chunk : splitText(text)) {
        int offset = Math.max(0, index + previousLength - overlap);
        int found = text.indexOf(chunk, offset);
        index = found >= 0 ? found : offset;
        previousLength = chunk.length();
        chunks.add(new TextChunk(chunk, page.page(), index));
      }
    }
    return chunks;
  }

  public List<String> splitText(String text) {
    return splitText(text, SEPARATORS);
  }

  private List<String> splitText(String text, List<String> separators) {
    String separator = separators.get(separators.size() - 1);
    List<String> finer = List.of();
    for (int i = 0; i < separators.size(); i++) {
      String candidate = separators.get(i);
      if (candidate.isEmpty()) {
        separator = candidate;
        break;
      }
      if (text.contains(candidate)) {
        separator = candidate;
        finer = separators.subList(i + 1, separators.size());
        break;
      }
    }

    List<String> result = new ArrayList<>();
    List<String> small = new ArrayList<>();
    for (String piece : splitKeepingSeparator(text, separator)) {
      if (piece.length() < chunkSize) {
        small.add(piece);
        continue;
      }
      if (!small.isEmpty()) {
        result.addAll(merge(small));
        small.clear();
      }
      if (finer.isEmpty()) {
        result.add(piece);
      } else {
        result.addAll(splitText(piece, finer));
      }
    }
    if (!small.isEmpty()) {
      result.addAll(merge(small));
    }
    return result;
  }

  /** Greedily packs pieces into chunks, carrying up to {@code overlap} characters forward. */
  private List<String> merge(List<String> pieces) {
    List<String> chunks = new ArrayList<>();
    List<String> current = new ArrayList<>();
    int total = 0;
    for (String piece : pieces) {
      int length = piece.length();
      if (total + length > chunkSize) {
        if (total > chunkSize) {
          log.warn("Created a chunk of size {}, longer than the limit {}", total, chunkSize);
        }
        if (!current.isEmpty()) {
          addJoined(chunks, current);
          while (total > overlap || (total + length > chunkSize && total > 0)) {
            total -= current.remove(0).length();
          }
        }
      }
      current.add(piece);
      total += length;
    }
    addJoined(chunks, current);
    return chunks;
  }

  private static void addJoined(List<String> chunks, List<String> pieces) {
    String joined = String.join("", pieces).strip();
    if (!joined.isEmpty()) {
      chunks.add(joined);
    }
  }

  private static List<String> splitKeepingSeparator(String text, String separator) {
    List<String> pieces = new ArrayList<>();
    if (separator.isEmpty()) {
      text.codePoints().forEach(cp -> pieces.add(new String(Character.toChars(cp))));
      return pieces;
    }
    int start = 0;
    int next = text.indexOf(separator);
    while (next >= 0) {
      if (next > start) {
        pieces.add(text.substring(start, next));
      }
      start = next;
      next = text.indexOf(separator, start + separator.length());
    }
    if (start < text.length()) {
      pieces.add(text.substring(start));
    }
    return pieces;
  }
}
