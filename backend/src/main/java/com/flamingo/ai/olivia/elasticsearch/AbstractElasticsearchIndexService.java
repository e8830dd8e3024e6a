package com.flamingo.ai.olivia.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.olivia.exception.SearchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for Elasticsearch-backed indices holding embedded documents.
 *
 * <p>Failures are not swallowed: search and write errors surface as {@link SearchException} so
 * callers can pick their own fallback. The {@code elasticsearch} circuit breaker only short-cuts
 * calls while the cluster is known to be down.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T, String> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public abstract String getIndexName();

  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  /**
   * Translates filter criteria into a query every hit must match. Implementations reject criteria
   * that would widen the search beyond a single owner.
   */
  protected abstract Query buildFilterQuery(Map<String, Object> criteria);

  /** Prefix for this index's meters, e.g. {@code document_chunk}. */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        log.debug("Elasticsearch index {} already exists", getIndexName());
      }
    } catch (Exception e) {
      // the cluster may come up after us; searches will fail until it does
      log.warn(
          "Could not check/create Elasticsearch index '{}': {}", getIndexName(), e.getMessage());
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index documents")
  @CircuitBreaker(name = "elasticsearch")
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }

    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (T document : documents) {
        String id = getDocumentId(document);
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        throw new SearchException(
            "Bulk indexing into " + getIndexName() + " reported item failures");
      }
      log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
    } catch (IOException e) {
      log.error("Failed to index documents to {}: {}", getIndexName(), e.getMessage(), e);
      throw new SearchException("Failed to index documents into " + getIndexName(), e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch")
  public List<T> vectorSearch(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    Query filter = buildFilterQuery(filterCriteria);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(getIndexName())
                    .knn(
                        k ->
                            k.field("embedding")
                                .queryVector(queryEmbedding)
                                .k(topK)
                                .numCandidates(Math.max(topK * 2, 10))
                                .filter(filter))
                    .size(topK));
    List<T> results = search(request, ScoreScale.COSINE, "vectorSearch");
    meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
    return results;
  }

  @Override
  @Timed(value = "elasticsearch.keyword_search", description = "Time for keyword search")
  @CircuitBreaker(name = "elasticsearch")
  public List<T> keywordSearch(Map<String, Object> filterCriteria, String query, int topK) {
    Query filter = buildFilterQuery(filterCriteria);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(getIndexName())
                    .query(
                        q ->
                            q.bool(
                                b ->
                                    b.filter(filter)
                                        .must(m -> m.match(mt -> mt.field("content").query(query)))))
                    .size(topK));
    List<T> results = search(request, ScoreScale.RELATIVE, "keywordSearch");
    meterRegistry.counter(getMetricPrefix() + ".keyword_search").increment();
    return results;
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public List<T> findBy(Map<String, Object> filterCriteria, int size) {
    Query filter = buildFilterQuery(filterCriteria);
    SearchRequest request =
        SearchRequest.of(s -> s.index(getIndexName()).query(filter).size(size));
    return search(request, ScoreScale.NONE, "findBy");
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete documents by criteria")
  public long deleteBy(Map<String, Object> criteria) {
    Query deleteQuery = buildFilterQuery(criteria);
    try {
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(deleteQuery));
      DeleteByQueryResponse response = elasticsearchClient.deleteByQuery(request);
      long deleted = response.deleted() != null ? response.deleted() : 0L;
      log.info(
          "Deleted {} documents from {} with criteria: {}", deleted, getIndexName(), criteria);
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment(deleted);
      return deleted;
    } catch (IOException e) {
      log.error(
          "Failed to delete documents from {} with criteria {}: {}",
          getIndexName(),
          criteria,
          e.getMessage(),
          e);
      throw new SearchException("Failed to delete documents from " + getIndexName(), e);
    }
  }

  /** Builds a filter query from exact-match terms on keyword or numeric fields. */
  protected static Query termsFilter(Map<String, Object> terms) {
    return Query.of(
        q ->
            q.bool(
                b -> {
                  terms.forEach(
                      (field, value) -> {
                        if (value instanceof Number n) {
                          b.filter(f -> f.term(t -> t.field(field).value(n.longValue())));
                        } else {
                          b.filter(f -> f.term(t -> t.field(field).value(String.valueOf(value))));
                        }
                      });
                  return b;
                }));
  }

  protected static Long asLong(Object value) {
    return value instanceof Number n ? n.longValue() : null;
  }

  protected static int asInt(Object value, int defaultValue) {
    return value instanceof Number n ? n.intValue() : defaultValue;
  }

  private List<T> search(SearchRequest request, ScoreScale scale, String searchType) {
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<Hit<Map>> hits = response.hits().hits();
      log.debug("[{}] index={} returned={}", searchType, getIndexName(), hits.size());

      double maxScore = 0.0;
      for (Hit<Map> hit : hits) {
        if (hit.score() != null) {
          maxScore = Math.max(maxScore, hit.score());
        }
      }

      List<T> documents = new ArrayList<>();
      for (Hit<Map> hit : hits) {
        Map<String, Object> source = hit.source();
        if (source == null) {
          continue;
        }
        Map<String, Object> copy = new HashMap<>(source);
        // _id is metadata, not part of _source
        copy.put("id", hit.id());
        T document = convertFromDocument(copy);
        if (document instanceof ScoredDocument scored && hit.score() != null) {
          scored.setRelevanceScore(scale.normalize(hit.score(), maxScore));
        }
        documents.add(document);
      }
      return documents;
    } catch (IOException e) {
      log.error("{} failed for {}: {}", searchType, getIndexName(), e.getMessage(), e);
      throw new SearchException(searchType + " failed for " + getIndexName(), e);
    }
  }

  /** Documents that carry the score of the hit that produced them. */
  public interface ScoredDocument {
    void setRelevanceScore(Double score);
  }

  /** Conversions from raw engine scores onto one "higher is better" scale. */
  enum ScoreScale {
    /** kNN over a cosine {@code dense_vector}: the engine reports {@code (1 + cos) / 2}. */
    COSINE {
      @Override
      double normalize(double raw, double maxScore) {
        return 2.0 * raw - 1.0;
      }
    },
    /** BM25 is unbounded, so scores are scaled by the best hit of the response. */
    RELATIVE {
      @Override
      double normalize(double raw, double maxScore) {
        return maxScore > 0 ? raw / maxScore : 0.0;
      }
    },
    NONE {
      @Override
      double normalize(double raw, double maxScore) {
        return raw;
      }
    };

    abstract double normalize(double raw, double maxScore);
  }
}
