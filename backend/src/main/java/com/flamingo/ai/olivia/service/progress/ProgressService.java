package com.flamingo.ai.olivia.service.progress;

import com.flamingo.ai.olivia.cache.CacheKeys;
import com.flamingo.ai.olivia.cache.TieredCacheService;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Publishes ingestion progress to every live subscriber of a user and records the latest value
 * per task for polling clients.
 *
 * <p>Each subscriber owns its sink and emission into it is serialized. A subscriber is dropped
 * only once its connection is gone, without affecting the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressService {

  private final TieredCacheService cacheService;
  private final Clock cacheClock;
  private final MeterRegistry meterRegistry;

  private final Map<Long, List<Sinks.Many<ProgressEvent>>> subscribers = new ConcurrentHashMap<>();

  /** Events for the user from now on; ends only when the subscriber cancels. */
  public Flux<ProgressEvent> subscribe(long userId) {
    Sinks.Many<ProgressEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
    subscribers.compute(
        userId,
        (id, sinks) -> {
          List<Sinks.Many<ProgressEvent>> target =
              sinks != null ? sinks : new CopyOnWriteArrayList<>();
          target.add(sink);
          return target;
        });
    log.debug("Progress subscriber added for user {}", userId);
    return sink.asFlux().doFinally(signal -> remove(userId, sink));
  }

  public void emit(long userId, int progress, String message, String taskId) {
    long now = cacheClock.millis();
    if (taskId != null) {
      cacheService.set(
          CacheKeys.progress(taskId),
          new ProgressSnapshot(progress, message, progress >= 0 && progress < 100, now),
          cacheService.ttl().getProgress());
    }
    log.debug("Progress {}% for task {} of user {}: {}", progress, taskId, userId, message);

    List<Sinks.Many<ProgressEvent>> sinks = subscribers.get(userId);
    if (sinks == null || sinks.isEmpty()) {
      return;
    }
    ProgressEvent event = ProgressEvent.of(progress, message, taskId, now);
    for (Sinks.Many<ProgressEvent> sink : sinks) {
      Sinks.EmitResult result = deliver(sink, event);
      if (result == Sinks.EmitResult.FAIL_CANCELLED
          || result == Sinks.EmitResult.FAIL_TERMINATED) {
        log.debug("Dropping progress subscriber of user {}: {}", userId, result);
        meterRegistry.counter("progress.delivery.failures").increment();
        remove(userId, sink);
      } else if (result.isFailure()) {
        log.warn("Progress event for user {} not delivered: {}", userId, result);
        meterRegistry.counter("progress.delivery.failures").increment();
      }
    }
  }

  // Unicast sinks reject concurrent producers; several tasks may report for the same user.
  private static Sinks.EmitResult deliver(Sinks.Many<ProgressEvent> sink, ProgressEvent event) {
    synchronized (sink) {
      return sink.tryEmitNext(event);
    }
  }

  public ProgressSnapshot latest(String taskId) {
    return cacheService
        .get(CacheKeys.progress(taskId), ProgressSnapshot.class)
        .orElseGet(ProgressSnapshot::unknown);
  }

  public int subscriberCount(long userId) {
    List<Sinks.Many<ProgressEvent>> sinks = subscribers.get(userId);
    return sinks != null ? sinks.size() : 0;
  }

  private void remove(long userId, Sinks.Many<ProgressEvent> sink) {
    subscribers.computeIfPresent(
        userId,
        (id, sinks) -> {
          sinks.remove(sink);
          return sinks.isEmpty() ? null : sinks;
        });
  }
}
