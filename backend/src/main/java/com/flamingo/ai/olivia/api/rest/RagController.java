package com.flamingo.ai.olivia.api.rest;

import com.flamingo.ai.olivia.api.dto.request.ChatRequest;
import com.flamingo.ai.olivia.api.dto.response.ChatResponse;
import com.flamingo.ai.olivia.service.rag.RagService;
import com.flamingo.ai.olivia.service.rag.RetrievedSources;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/** REST controller for complete, non-streamed answers. */
@RestController
@RequestMapping("/api/users/{userId}/collections/{collectionId}")
@RequiredArgsConstructor
@Slf4j
public class RagController {

  private final RagService ragService;

  @PostMapping("/chat")
  public Mono<ChatResponse> chat(
      @PathVariable long userId,
      @PathVariable long collectionId,
      @Valid @RequestBody ChatRequest request) {
    log.debug("Chat request for user={} collection={}", userId, collectionId);
    return ragService.chat(request.toQuery(userId, collectionId)).map(ChatResponse::fromAnswer);
  }

  /** Retrieval without generation: what an answer to the question would cite. */
  @PostMapping("/sources")
  public Mono<RetrievedSources> sources(
      @PathVariable long userId,
      @PathVariable long collectionId,
      @Valid @RequestBody ChatRequest request) {
    log.debug("Sources request for user={} collection={}", userId, collectionId);
    return ragService.getSources(request.toQuery(userId, collectionId));
  }
}
