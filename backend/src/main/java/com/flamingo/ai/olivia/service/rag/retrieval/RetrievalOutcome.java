package com.flamingo.ai.olivia.service.rag.retrieval;

import java.util.List;

/**
 * Result of a primary vector retrieval. When {@link #fallbackNeeded()} is set the documents are
 * empty and the caller decides how to recover.
 */
public record RetrievalOutcome(
    List<RetrievedDocument> documents, boolean fallbackNeeded, String failureReason) {

  public static RetrievalOutcome success(List<RetrievedDocument> documents) {
    return new RetrievalOutcome(List.copyOf(documents), false, null);
  }

  public static RetrievalOutcome fallbackNeeded(String reason) {
    return new RetrievalOutcome(List.of(), true, reason);
  }
}
