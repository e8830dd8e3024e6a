package com.flamingo.ai.olivia.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * Narrow contract the application needs from a vector index.
 *
 * <p>Scores on returned documents are always on a "higher is better" scale; implementations
 * convert the engine's raw scores before handing results back.
 *
 * @param <T> the document type stored in the index
 * @param <ID> the document ID type
 */
public interface ElasticsearchIndexOperations<T, ID> {

  /** Creates the index with its mappings if it does not exist yet. */
  void initIndex();

  /**
   * Inserts documents in one bulk request.
   *
   * @throws com.flamingo.ai.olivia.exception.SearchException if the write fails
   */
  void indexDocuments(List<T> documents);

  /**
   * Nearest-neighbour search restricted by term filters.
   *
   * @param filterCriteria field/value pairs every hit must match exactly
   * @return hits ordered by cosine similarity, best first
   */
  List<T> vectorSearch(Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  /**
   * Full-text search restricted by term filters.
   *
   * @return hits ordered by relevance, scores scaled into {@code (0, 1]}
   */
  List<T> keywordSearch(Map<String, Object> filterCriteria, String query, int topK);

  /** Returns up to {@code size} documents matching the filters, in no particular order. */
  List<T> findBy(Map<String, Object> filterCriteria, int size);

  /**
   * Deletes documents matching every given criterion.
   *
   * @return number of deleted documents
   */
  long deleteBy(Map<String, Object> criteria);

  String getIndexName();
}
