package com.flamingo.ai.olivia.api.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.olivia.service.rag.ChatQuery;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking a question about a collection. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 10000, message = "Query must not exceed 10000 characters")
  private String query;

  /** Sampling temperature; defaults to {@code rag.generation.default-temperature}. */
  @DecimalMin(value = "0.0", message = "Temperature must be at least 0")
  @DecimalMax(value = "2.0", message = "Temperature must be at most 2")
  private Double temperature;

  /** Base result count before complexity adjustment; defaults to the configured top-k. */
  @JsonProperty("top_k")
  @Min(value = 1, message = "top_k must be at least 1")
  @Max(value = 100, message = "top_k must be at most 100")
  private Integer topK;

  @JsonProperty("custom_prompt")
  @Size(max = 10000, message = "Custom prompt must not exceed 10000 characters")
  private String customPrompt;

  @JsonProperty("fetch_sources")
  private boolean fetchSources;

  public ChatQuery toQuery(long userId, long collectionId) {
    return ChatQuery.builder()
        .userId(userId)
        .collectionId(collectionId)
        .query(query)
        .topK(topK)
        .temperature(temperature)
        .customPrompt(customPrompt)
        .fetchSources(fetchSources)
        .build();
  }
}
