package com.flamingo.ai.olivia.service.rag;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.olivia.service.rag.retrieval.QueryComplexity;

/** What the retrieval step did for one answer. */
public record RetrievalInfo(
    QueryComplexity complexity,
    @JsonProperty("top_k_used") int topKUsed,
    @JsonProperty("min_score_used") double minScoreUsed,
    @JsonProperty("query_expanded") boolean queryExpanded,
    @JsonProperty("docs_retrieved") int docsRetrieved,
    @JsonProperty("fallback_used") boolean fallbackUsed) {}
