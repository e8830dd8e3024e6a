package com.flamingo.ai.olivia.service.rag.visualization;

import com.flamingo.ai.olivia.elasticsearch.DocumentChunk;
import com.flamingo.ai.olivia.service.rag.visualization.DocumentVectors.Color;
import com.flamingo.ai.olivia.service.rag.visualization.DocumentVectors.Metadata;
import com.flamingo.ai.olivia.service.rag.visualization.DocumentVectors.Position;
import com.flamingo.ai.olivia.service.rag.visualization.DocumentVectors.VectorPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.Clusterable;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.JDKRandomGenerator;
import org.springframework.stereotype.Component;

/**
 * Reduces chunk embeddings to three principal components, groups them with k-means and colours
 * each point by its angle around the vertical axis.
 */
@Component
@Slf4j
public class EmbeddingProjector {

  static final int DIMENSIONS = 3;

  private static final int MIN_VECTORS = 3;
  private static final int MAX_CLUSTERS = 5;
  private static final int MAX_KMEANS_ITERATIONS = 100;
  private static final int SEED = 42;
  private static final double RADIUS = 3.0;
  private static final int PREVIEW_CHARS = 100;

  public DocumentVectors project(List<DocumentChunk> chunks) {
    List<DocumentChunk> embedded =
        chunks.stream()
            .filter(chunk -> chunk.getEmbedding() != null && !chunk.getEmbedding().isEmpty())
            .collect(Collectors.toCollection(ArrayList::new));
    if (embedded.isEmpty()) {
      log.info("No stored embeddings among {} chunks", chunks.size());
      return DocumentVectors.empty(0);
    }
    int originalDimensions = embedded.get(0).getEmbedding().size();
    embedded.removeIf(chunk -> chunk.getEmbedding().size() != originalDimensions);
    if (embedded.size() < MIN_VECTORS) {
      log.info("Only {} vectors, too few for a 3-D projection", embedded.size());
      return DocumentVectors.empty(originalDimensions);
    }

    RealMatrix data = toMatrix(embedded, originalDimensions);
    RealMatrix projected = principalComponents(data);
    double[] similarities = meanCosineSimilarities(data);
    int[] clusters = cluster(projected);

    List<Double> points = new ArrayList<>();
    List<Double> colors = new ArrayList<>();
    List<VectorPoint> vectorPoints = new ArrayList<>();
    for (int i = 0; i < embedded.size(); i++) {
      double[] position = onSphere(projected.getRow(i));
      Color color = colorFor(position);
      points.add(position[0]);
      points.add(position[1]);
      points.add(position[2]);
      colors.add(color.r());
      colors.add(color.g());
      colors.add(color.b());

      DocumentChunk chunk = embedded.get(i);
      vectorPoints.add(
          new VectorPoint(
              new Position(position[0], position[1], position[2]),
              color,
              new Metadata(
                  i,
                  similarities[i],
                  clusters[i],
                  preview(chunk.getContent()),
                  chunk.getPage(),
                  chunk.getStartIndex())));
    }
    log.debug("Projected {} vectors of dimension {}", vectorPoints.size(), originalDimensions);
    return new DocumentVectors(
        points, colors, vectorPoints.size(), vectorPoints, DIMENSIONS, originalDimensions);
  }

  /** Scores of each row on the first three principal components, zero-padded. */
  static RealMatrix principalComponents(RealMatrix data) {
    int rows = data.getRowDimension();
    int columns = data.getColumnDimension();
    RealMatrix centered = data.copy();
    for (int c = 0; c < columns; c++) {
      double mean = 0.0;
      for (int r = 0; r < rows; r++) {
        mean += data.getEntry(r, c);
      }
      mean /= rows;
      for (int r = 0; r < rows; r++) {
        centered.addToEntry(r, c, -mean);
      }
    }

    RealMatrix v = new SingularValueDecomposition(centered).getV();
    int components = Math.min(DIMENSIONS, v.getColumnDimension());
    RealMatrix scores = centered.multiply(v.getSubMatrix(0, columns - 1, 0, components - 1));
    RealMatrix result = new Array2DRowRealMatrix(rows, DIMENSIONS);
    result.setSubMatrix(scores.getData(), 0, 0);
    return result;
  }

  static double[] meanCosineSimilarities(RealMatrix data) {
    int rows = data.getRowDimension();
    double[][] unit = new double[rows][];
    for (int r = 0; r < rows; r++) {
      double[] row = data.getRow(r);
      double norm = norm(row);
      for (int c = 0; c < row.length; c++) {
        row[c] = norm > 0 ? row[c] / norm : 0.0;
      }
      unit[r] = row;
    }
    double[] means = new double[rows];
    for (int i = 0; i < rows; i++) {
      double sum = 0.0;
      for (int j = 0; j < rows; j++) {
        sum += dot(unit[i], unit[j]);
      }
      means[i] = sum / rows;
    }
    return means;
  }

  /** HSL to RGB, every channel in {@code [0, 1]}. */
  static Color hslToRgb(double h, double s, double l) {
    double c = (1 - Math.abs(2 * l - 1)) * s;
    double x = c * (1 - Math.abs((h * 6) % 2 - 1));
    double m = l - c / 2;
    double r;
    double g;
    double b;
    if (h < 1.0 / 6) {
      r = c;
      g = x;
      b = 0;
    } else if (h < 2.0 / 6) {
      r = x;
      g = c;
      b = 0;
    } else if (h < 3.0 / 6) {
      r = 0;
      g = c;
      b = x;
    } else if (h < 4.0 / 6) {
      r = 0;
      g = x;
      b = c;
    } else if (h < 5.0 / 6) {
      r = x;
      g = 0;
      b = c;
    } else {
      r = c;
      g = 0;
      b = x;
    }
    return new Color(r + m, g + m, b + m);
  }

  private static int[] cluster(RealMatrix projected) {
    int rows = projected.getRowDimension();
    List<IndexedPoint> points = new ArrayList<>(rows);
    for (int i = 0; i < rows; i++) {
      points.add(new IndexedPoint(i, projected.getRow(i)));
    }
    int[] assignment = new int[rows];
    KMeansPlusPlusClusterer<IndexedPoint> clusterer =
        new KMeansPlusPlusClusterer<>(
            Math.min(MAX_CLUSTERS, rows),
            MAX_KMEANS_ITERATIONS,
            new EuclideanDistance(),
            new JDKRandomGenerator(SEED));
    try {
      List<CentroidCluster<IndexedPoint>> clusters = clusterer.cluster(points);
      for (int c = 0; c < clusters.size(); c++) {
        for (IndexedPoint point : clusters.get(c).getPoints()) {
          assignment[point.index()] = c;
        }
      }
    } catch (MathIllegalStateException e) {
      // degenerate layouts (e.g. identical vectors) leave every point in cluster 0
      log.warn("Clustering {} points failed: {}", rows, e.getMessage());
    }
    return assignment;
  }

  private static double[] onSphere(double[] point) {
    double norm = norm(point);
    if (norm == 0) {
      return point;
    }
    return new double[] {
      point[0] / norm * RADIUS, point[1] / norm * RADIUS, point[2] / norm * RADIUS
    };
  }

  private static Color colorFor(double[] position) {
    double hue = (Math.atan2(position[1], position[0]) / (2 * Math.PI) + 1) % 1;
    return hslToRgb(hue * 0.8, 0.6, 0.5);
  }

  private static RealMatrix toMatrix(List<DocumentChunk> chunks, int dimensions) {
    RealMatrix matrix = new Array2DRowRealMatrix(chunks.size(), dimensions);
    for (int r = 0; r < chunks.size(); r++) {
      List<Float> embedding = chunks.get(r).getEmbedding();
      for (int c = 0; c < dimensions; c++) {
        matrix.setEntry(r, c, embedding.get(c));
      }
    }
    return matrix;
  }

  private static String preview(String content) {
    if (content == null) {
      return "";
    }
    return content.length() <= PREVIEW_CHARS ? content : content.substring(0, PREVIEW_CHARS);
  }

  private static double norm(double[] vector) {
    return Math.sqrt(dot(vector, vector));
  }

  private static double dot(double[] a, double[] b) {
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      sum += a[i] * b[i];
    }
    return sum;
  }

  private record IndexedPoint(int index, double[] coordinates) implements Clusterable {
    @Override
    public double[] getPoint() {
      return coordinates;
    }
  }
}
