package com.flamingo.ai.olivia.service.rag;

import lombok.Builder;

/**
 * A question against one collection of one user.
 *
 * @param topK base result count before complexity adjustment, {@code null} for the default
 * @param temperature sampling temperature, {@code null} for the default
 * @param customPrompt template overriding the built-in prompts, may be blank
 * @param fetchSources whether to retrieve and return citations; streaming without them skips
 *     retrieval entirely
 */
@Builder
public record ChatQuery(
    long userId,
    long collectionId,
    String query,
    Integer topK,
    Double temperature,
    String customPrompt,
    boolean fetchSources) {}
