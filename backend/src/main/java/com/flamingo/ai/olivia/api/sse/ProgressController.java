package com.flamingo.ai.olivia.api.sse;

import com.flamingo.ai.olivia.service.progress.ProgressEvent;
import com.flamingo.ai.olivia.service.progress.ProgressService;
import com.flamingo.ai.olivia.service.progress.ProgressSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Ingestion progress: a live stream per user and a polling fallback per task. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ProgressController {

  private final ProgressService progressService;

  @GetMapping(
      value = "/users/{userId}/progress/stream",
      produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ProgressEvent> streamProgress(@PathVariable long userId) {
    log.debug("Progress stream opened for user={}", userId);
    return progressService.subscribe(userId);
  }

  /** Latest progress of a task, or a neutral "Processing" value when none is recorded. */
  @GetMapping("/progress/{taskId}")
  public ResponseEntity<ProgressSnapshot> getProgress(@PathVariable String taskId) {
    return ResponseEntity.ok(progressService.latest(taskId));
  }
}
