package com.flamingo.ai.olivia.service.rag;

import com.flamingo.ai.olivia.api.dto.response.StreamEvent;
import com.flamingo.ai.olivia.service.rag.visualization.DocumentVectors;
import java.util.List;
import java.util.Optional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** Answers questions from a user's documents and manages their indexed vectors. */
public interface RagService {

  /**
   * Answers in one piece.
   *
   * @throws com.flamingo.ai.olivia.exception.SearchException if neither vector nor keyword
   *     retrieval is available
   * @throws com.flamingo.ai.olivia.exception.LlmServiceException if generation fails
   */
  Mono<RagAnswer> chat(ChatQuery query);

  /** Streams the answer. Failures end the stream with an error frame instead of an error signal. */
  Flux<StreamEvent> streamChat(ChatQuery query);

  /**
   * Runs retrieval only: the citations an answer would cite, and how they were found.
   *
   * @throws com.flamingo.ai.olivia.exception.SearchException if neither vector nor keyword
   *     retrieval is available
   */
  Mono<RetrievedSources> getSources(ChatQuery query);

  /** Deletes the vectors of one document and every cache entry derived from them. */
  void deleteDocumentVectors(long userId, long collectionId, String source);

  /** Deletes every vector of a collection and every cache entry derived from them. */
  void deleteCollectionVectors(long userId, long collectionId);

  List<ChunkPreview> getDocumentChunks(long userId, long collectionId, String source);

  /** Stored chunk vectors of one document projected to 3-D; empty if no chunk is indexed. */
  Optional<DocumentVectors> getDocumentVectors(long userId, long collectionId, String source);
}
