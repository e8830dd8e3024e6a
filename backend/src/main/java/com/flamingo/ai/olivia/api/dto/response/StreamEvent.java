package com.flamingo.ai.olivia.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.olivia.service.rag.retrieval.SourceCitation;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One server-sent frame of a streamed answer.
 *
 * <p>A {@code sources} frame, when present, precedes every {@code chunk} frame. An {@code error}
 * frame ends the stream abnormally.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamEvent {

  public static final String SOURCES = "sources";
  public static final String CHUNK = "chunk";
  public static final String ERROR = "error";

  /** Frame type: sources, chunk or error. */
  private String type;

  private List<SourceCitation> sources;
  private String content;
  private String message;

  public static StreamEvent sources(List<SourceCitation> sources) {
    return StreamEvent.builder().type(SOURCES).sources(sources).build();
  }

  public static StreamEvent chunk(String content) {
    return StreamEvent.builder().type(CHUNK).content(content).build();
  }

  public static StreamEvent error(String message) {
    return StreamEvent.builder().type(ERROR).message(message).build();
  }
}
