package com.flamingo.ai.olivia.service.rag.retrieval;

/**
 * A chunk returned by the vector index for one request.
 *
 * @param score similarity on a "higher is better" scale
 */
public record RetrievedDocument(
    String content, String source, double score, long userId, long collectionId, int page) {}
