package com.flamingo.ai.olivia.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the RAG pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Retrieval retrieval = new Retrieval();
  private Generation generation = new Generation();
  private Chunking chunking = new Chunking();
  private Ingestion ingestion = new Ingestion();
  private SemanticCache semanticCache = new SemanticCache();

  @Getter
  @Setter
  public static class Retrieval {
    private int defaultTopK = 20;

    /** Hard ceiling applied after the complexity analyzer. */
    private int maxTopK = 50;

    /** Hard floor applied after the complexity analyzer. */
    private double minSimilarityThreshold = 0.0;

    private boolean dynamicEnabled = true;
    private boolean queryExpansionEnabled = true;
    private int maxQueryVariants = 3;

    /** Number of citations kept after per-source collapsing. */
    private int citationLimit = 5;
  }

  @Getter
  @Setter
  public static class Generation {
    private double defaultTemperature = 0.0;
    private int maxTokens = 2048;

    /** Pick analytical/detailed/concise templates from query wording instead of the default. */
    private boolean adaptivePrompts = false;
  }

  @Getter
  @Setter
  public static class Chunking {
    private int size = 768;
    private int overlap = 150;
    private int splitterCacheSize = 16;
  }

  @Getter
  @Setter
  public static class Ingestion {
    private int batchSize = 100;
    private int embeddingBatchSize = 32;
    private String uploadDir = "data/uploads";
    private long maxFileSizeBytes = 50 * 1024 * 1024L; // 50 MB
  }

  @Getter
  @Setter
  public static class SemanticCache {
    private boolean enabled = false;
    private double threshold = 0.92;
  }
}
