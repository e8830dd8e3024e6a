package com.flamingo.ai.olivia.service.rag.embedding;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Turns text into vectors for the vector index. */
public interface Embedder {

  List<Float> embedQuery(String text);

  /** Embeds texts in order; the result has one vector per input. */
  List<List<Float>> embedDocuments(List<String> texts);

  CompletableFuture<List<Float>> embedQueryAsync(String text);

  CompletableFuture<List<List<Float>>> embedDocumentsAsync(List<String> texts);
}
