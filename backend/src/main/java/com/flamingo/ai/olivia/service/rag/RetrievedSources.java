package com.flamingo.ai.olivia.service.rag;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.olivia.service.rag.retrieval.SourceCitation;
import java.util.List;

/** Citations found for a question, without an answer. */
public record RetrievedSources(
    String query,
    @JsonProperty("collection_id") long collectionId,
    List<SourceCitation> sources,
    @JsonProperty("retrieval_info") RetrievalInfo retrievalInfo) {}
