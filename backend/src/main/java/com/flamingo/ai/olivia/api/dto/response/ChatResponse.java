package com.flamingo.ai.olivia.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.olivia.service.rag.RagAnswer;
import com.flamingo.ai.olivia.service.rag.RetrievalInfo;
import com.flamingo.ai.olivia.service.rag.retrieval.SourceCitation;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a complete answer. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatResponse {
  private String response;
  private List<SourceCitation> sources;
  private boolean cached;

  @JsonProperty("retrieval_info")
  private RetrievalInfo retrievalInfo;

  public static ChatResponse fromAnswer(RagAnswer answer) {
    return ChatResponse.builder()
        .response(answer.response())
        .sources(answer.sources())
        .cached(answer.cached())
        .retrievalInfo(answer.retrievalInfo())
        .build();
  }
}
