package com.flamingo.ai.olivia.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/** Per-user index of question embeddings and the answers given to them. */
@Service
public class SemanticCacheIndexService
    extends AbstractElasticsearchIndexService<SemanticCacheEntry> {

  public static final String USER_ID = "userId";

  @Value("${app.elasticsearch.semantic-cache-index-name:olivia-semantic-cache}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  public SemanticCacheIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put(USER_ID, Property.of(p -> p.long_(l -> l)));
    properties.put("query", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("response", Property.of(p -> p.text(t -> t.index(false))));
    properties.put("sourcesJson", Property.of(p -> p.text(t -> t.index(false))));
    properties.put("timestamp", Property.of(p -> p.long_(l -> l)));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(SemanticCacheEntry entry) {
    Map<String, Object> document = new HashMap<>();
    document.put(USER_ID, entry.getUserId());
    document.put("query", entry.getQuery());
    document.put("response", entry.getResponse());
    document.put("sourcesJson", entry.getSourcesJson());
    document.put("timestamp", entry.getTimestamp());
    document.put("embedding", entry.getEmbedding());
    return document;
  }

  @Override
  protected SemanticCacheEntry convertFromDocument(Map<String, Object> source) {
    Long timestamp = asLong(source.get("timestamp"));
    return SemanticCacheEntry.builder()
        .id((String) source.get("id"))
        .userId(asLong(source.get(USER_ID)))
        .query((String) source.get("query"))
        .response((String) source.get("response"))
        .sourcesJson((String) source.get("sourcesJson"))
        .timestamp(timestamp != null ? timestamp : 0L)
        .build();
  }

  @Override
  protected String getDocumentId(SemanticCacheEntry entity) {
    return entity.getId();
  }

  @Override
  protected Query buildFilterQuery(Map<String, Object> criteria) {
    Object userId = criteria.get(USER_ID);
    if (userId == null) {
      throw new IllegalArgumentException("userId filter is required for " + indexName);
    }
    return termsFilter(Map.of(USER_ID, userId));
  }

  @Override
  protected String getMetricPrefix() {
    return "semantic_cache";
  }

  /** The user's closest cached question, if any. */
  public Optional<SemanticCacheEntry> nearest(long userId, List<Float> queryEmbedding) {
    List<SemanticCacheEntry> hits = vectorSearch(Map.of(USER_ID, userId), queryEmbedding, 1);
    return hits.stream().findFirst();
  }

  public long deleteByUser(long userId) {
    return deleteBy(Map.of(USER_ID, userId));
  }
}
