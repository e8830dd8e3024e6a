package com.flamingo.ai.olivia.service.rag;

import com.flamingo.ai.olivia.service.rag.retrieval.SourceCitation;
import java.util.List;

/**
 * A complete answer.
 *
 * @param cached whether the answer came from the semantic or the response cache
 * @param retrievalInfo {@code null} when the semantic cache answered
 */
public record RagAnswer(
    String response, List<SourceCitation> sources, boolean cached, RetrievalInfo retrievalInfo) {}
