package com.flamingo.ai.olivia.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Index of document chunks, partitioned by {@code (userId, collectionId)}.
 *
 * <p>Every search and delete carries the owner filter; a request without a user id is rejected
 * before it reaches the cluster.
 */
@Service
@Slf4j
public class DocumentChunkIndexService extends AbstractElasticsearchIndexService<DocumentChunk> {

  public static final String USER_ID = "userId";
  public static final String COLLECTION_ID = "collectionId";
  public static final String SOURCE = "source";

  private static final int MAX_CHUNKS_PER_SOURCE = 10_000;

  @Value("${app.elasticsearch.index-name:olivia-chunks}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Autowired
  public DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  public DocumentChunkIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put(USER_ID, Property.of(p -> p.long_(l -> l)));
    properties.put(COLLECTION_ID, Property.of(p -> p.long_(l -> l)));
    // keyword: deletion by file name must be an exact match
    properties.put(SOURCE, Property.of(p -> p.keyword(k -> k)));
    properties.put("fileType", Property.of(p -> p.keyword(k -> k)));
    properties.put("title", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("page", Property.of(p -> p.integer(i -> i)));
    properties.put("totalPages", Property.of(p -> p.integer(i -> i)));
    properties.put("startIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("content", Property.of(p -> p.text(TextProperty.of(t -> t))));
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
  protected Map<String, Object> convertToDocument(DocumentChunk chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put(USER_ID, chunk.getUserId());
    document.put(COLLECTION_ID, chunk.getCollectionId());
    document.put(SOURCE, chunk.getSource());
    document.put("fileType", chunk.getFileType());
    if (chunk.getTitle() != null) {
      document.put("title", chunk.getTitle());
    }
    document.put("page", chunk.getPage());
    document.put("totalPages", chunk.getTotalPages());
    document.put("startIndex", chunk.getStartIndex());
    document.put("content", chunk.getContent());
    document.put("embedding", chunk.getEmbedding());
    return document;
  }

  @Override
  protected DocumentChunk convertFromDocument(Map<String, Object> source) {
    return DocumentChunk.builder()
        .id((String) source.get("id"))
        .userId(asLong(source.get(USER_ID)))
        .collectionId(asLong(source.get(COLLECTION_ID)))
        .source((String) source.get(SOURCE))
        .fileType((String) source.get("fileType"))
        .title((String) source.get("title"))
        .page(asInt(source.get("page"), 1))
        .totalPages(asInt(source.get("totalPages"), 0))
        .startIndex(asInt(source.get("startIndex"), 0))
        .content((String) source.get("content"))
        .embedding(asFloats(source.get("embedding")))
        .build();
  }

  private static List<Float> asFloats(Object value) {
    if (!(value instanceof List<?> list)) {
      return null;
    }
    List<Float> vector = new ArrayList<>(list.size());
    for (Object component : list) {
      vector.add(component instanceof Number n ? n.floatValue() : 0f);
    }
    return vector;
  }

  @Override
  protected String getDocumentId(DocumentChunk entity) {
    return entity.getId();
  }

  @Override
  protected Query buildFilterQuery(Map<String, Object> criteria) {
    if (criteria.get(USER_ID) == null) {
      throw new IllegalArgumentException("userId filter is required for " + indexName);
    }
    Map<String, Object> terms = new LinkedHashMap<>();
    for (String field : List.of(USER_ID, COLLECTION_ID, SOURCE)) {
      if (criteria.get(field) != null) {
        terms.put(field, criteria.get(field));
      }
    }
    return termsFilter(terms);
  }

  @Override
  protected String getMetricPrefix() {
    return "document_chunk";
  }

  /** Vector search within one collection. */
  public List<DocumentChunk> vectorSearch(
      long userId, long collectionId, List<Float> queryEmbedding, int topK) {
    return vectorSearch(owner(userId, collectionId), queryEmbedding, topK);
  }

  /** BM25 search within one collection. */
  public List<DocumentChunk> keywordSearch(
      long userId, long collectionId, String query, int topK) {
    return keywordSearch(owner(userId, collectionId), query, topK);
  }

  /** All chunks of one file, ordered by page then offset. */
  public List<DocumentChunk> findBySource(long userId, long collectionId, String source) {
    Map<String, Object> criteria = owner(userId, collectionId);
    criteria.put(SOURCE, source);
    List<DocumentChunk> chunks = new ArrayList<>(findBy(criteria, MAX_CHUNKS_PER_SOURCE));
    chunks.sort(
        Comparator.comparingInt(DocumentChunk::getPage)
            .thenComparingInt(DocumentChunk::getStartIndex));
    return chunks;
  }

  /**
   * Deletes the chunks of one file. Zero deleted chunks is not an error.
   *
   * @return number of deleted chunks
   */
  public long deleteBySource(long userId, long collectionId, String source) {
    Map<String, Object> criteria = owner(userId, collectionId);
    criteria.put(SOURCE, source);
    return deleteBy(criteria);
  }

  public long deleteByCollection(long userId, long collectionId) {
    return deleteBy(owner(userId, collectionId));
  }

  private static Map<String, Object> owner(long userId, long collectionId) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put(USER_ID, userId);
    criteria.put(COLLECTION_ID, collectionId);
    return criteria;
  }
}
