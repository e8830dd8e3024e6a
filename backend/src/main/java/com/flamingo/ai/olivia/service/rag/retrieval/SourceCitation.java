package com.flamingo.ai.olivia.service.rag.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One cited file with its best-scoring chunk as preview. */
public record SourceCitation(
    String source, @JsonProperty("similarity_score") double similarityScore, String content) {}
