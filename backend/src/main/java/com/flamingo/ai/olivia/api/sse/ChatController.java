package com.flamingo.ai.olivia.api.sse;

import com.flamingo.ai.olivia.api.dto.request.ChatRequest;
import com.flamingo.ai.olivia.api.dto.response.StreamEvent;
import com.flamingo.ai.olivia.service.rag.RagService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller for streamed answers over Server-Sent Events. */
@RestController
@RequestMapping("/api/users/{userId}/collections/{collectionId}")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

  private final RagService ragService;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  /**
   * Streams an answer. A {@code sources} frame comes first when sources were requested and found;
   * failures arrive as a final {@code error} frame.
   */
  @PostMapping(value = "/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<StreamEvent> streamChat(
      @PathVariable long userId,
      @PathVariable long collectionId,
      @Valid @RequestBody ChatRequest request) {

    log.info("Starting answer stream for user={} collection={}", userId, collectionId);
    activeConnections.incrementAndGet();
    meterRegistry.gauge("sse.connections.active", activeConnections);

    return ragService
        .streamChat(request.toQuery(userId, collectionId))
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Answer stream completed for user={}", userId);
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("Answer stream error for user={}: {}", userId, e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Answer stream cancelled for user={}", userId);
            });
  }
}
