package com.flamingo.ai.olivia.service.rag.semantic;

import com.flamingo.ai.olivia.service.rag.retrieval.SourceCitation;
import java.util.List;

/** An answer reused from a semantically equivalent earlier question. */
public record CachedAnswer(String answer, List<SourceCitation> citations, double similarity) {}
