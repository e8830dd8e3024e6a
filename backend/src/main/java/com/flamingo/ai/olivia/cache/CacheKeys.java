package com.flamingo.ai.olivia.cache;

import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Builds every cache key used by the application.
 *
 * <p>Keys have the form {@code <namespace>:<qualifiers...>}. Variable-length text is reduced to a
 * 128-bit hex digest. Keys scoped to an owner carry the user and collection ids in clear text
 * ahead of the digest so that invalidation can sweep them by prefix.
 */
public final class CacheKeys {

  public static final String EMBEDDING = "embed:";
  public static final String BATCH_EMBEDDING = "batch_embed:";
  public static final String VECTOR_RESULTS = "vector:";
  public static final String LLM_RESPONSE = "llm:";
  public static final String SESSION = "session:";
  public static final String DOCUMENT_CHUNKS = "chunks:";
  public static final String TRANSLATION = "trans:";
  public static final String USER_COLLECTIONS = "user_collections:";
  public static final String USER_SETTINGS = "user_settings:";
  public static final String PROGRESS = "progress:";

  private static final int DIGEST_BYTES = 16;

  private CacheKeys() {}

  /** SHA-256 truncated to 16 bytes, lower-case hex. */
  public static String fastHash(String data) {
    byte[] digest = Hashing.sha256().hashString(data, StandardCharsets.UTF_8).asBytes();
    return BaseEncoding.base16().lowerCase().encode(digest, 0, DIGEST_BYTES);
  }

  public static String embedding(String text) {
    return EMBEDDING + fastHash(text);
  }

  public static String batchEmbedding(List<String> texts) {
    return BATCH_EMBEDDING + fastHash(String.join("\n", texts));
  }

  public static String vectorResults(long userId, long collectionId, String query, int topK) {
    return vectorPrefix(userId, collectionId)
        + fastHash(query + ":" + userId + ":" + collectionId + ":" + topK);
  }

  public static String llmResponse(
      long userId,
      long collectionId,
      String query,
      String context,
      double temperature,
      String customPrompt) {
    String keyData =
        query
            + ":"
            + context
            + ":"
            + temperature
            + ":"
            + (customPrompt != null ? customPrompt : "")
            + ":"
            + userId
            + ":"
            + collectionId;
    return llmPrefix(userId, collectionId) + fastHash(keyData);
  }

  public static String documentChunks(long userId, long collectionId, String source) {
    return chunksPrefix(userId, collectionId) + fastHash(source);
  }

  public static String session(String sessionId) {
    return SESSION + sessionId;
  }

  public static String translation(String langPair, String text) {
    return TRANSLATION + langPair + ":" + fastHash(text);
  }

  public static String userCollections(long userId) {
    return USER_COLLECTIONS + userId;
  }

  public static String userSettings(long userId) {
    return USER_SETTINGS + userId;
  }

  public static String progress(String taskId) {
    return PROGRESS + taskId;
  }

  public static String vectorPrefix(long userId, long collectionId) {
    return VECTOR_RESULTS + ownerScope(userId, collectionId);
  }

  public static String llmPrefix(long userId, long collectionId) {
    return LLM_RESPONSE + ownerScope(userId, collectionId);
  }

  public static String chunksPrefix(long userId, long collectionId) {
    return DOCUMENT_CHUNKS + ownerScope(userId, collectionId);
  }

  // Trailing separator keeps user 1/collection 2 from matching collection 23.
  private static String ownerScope(long userId, long collectionId) {
    return userId + ":" + collectionId + ":";
  }
}
