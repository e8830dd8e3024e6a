package com.flamingo.ai.olivia.service.rag.visualization;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The chunks of one document placed in 3-D space for display.
 *
 * @param points flattened {@code x, y, z} triples, one per chunk
 * @param colors flattened {@code r, g, b} triples in {@code [0, 1]}, parallel to {@code points}
 * @param originalDimensions dimensionality of the stored embeddings, 0 when none were found
 */
public record DocumentVectors(
    List<Double> points,
    List<Double> colors,
    int count,
    List<VectorPoint> vectorPoints,
    int dimensions,
    @JsonProperty("original_dimensions") int originalDimensions) {

  public static DocumentVectors empty(int originalDimensions) {
    return new DocumentVectors(
        List.of(), List.of(), 0, List.of(), EmbeddingProjector.DIMENSIONS, originalDimensions);
  }

  public record VectorPoint(Position position, Color color, Metadata metadata) {}

  public record Position(double x, double y, double z) {}

  public record Color(double r, double g, double b) {}

  /**
   * @param similarity mean cosine similarity of the chunk to every chunk of the document
   * @param text first characters of the chunk
   */
  public record Metadata(
      int index, double similarity, int cluster, String text, int page, int startIndex) {}
}
