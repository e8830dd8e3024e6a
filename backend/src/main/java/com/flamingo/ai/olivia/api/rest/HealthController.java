package com.flamingo.ai.olivia.api.rest;

import com.flamingo.ai.olivia.api.dto.response.CacheReport;
import com.flamingo.ai.olivia.cache.CacheMonitor;
import com.flamingo.ai.olivia.cache.PerformanceReport;
import com.flamingo.ai.olivia.service.health.HealthService;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and cache statistics. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final HealthService healthService;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "olivia");
    return ResponseEntity.ok(health);
  }

  @GetMapping("/cache")
  public ResponseEntity<CacheReport> cache() {
    return ResponseEntity.ok(healthService.getCacheReport());
  }

  /** Resets hit/miss counters; the body shows the values before the reset. */
  @PostMapping("/cache/reset-metrics")
  public ResponseEntity<CacheReport> resetCacheMetrics() {
    return ResponseEntity.ok(healthService.resetCacheMetrics());
  }

  @GetMapping("/cache/history")
  public ResponseEntity<List<CacheMonitor.MetricsSnapshot>> cacheHistory(
      @RequestParam(defaultValue = "1") int hours) {
    return ResponseEntity.ok(healthService.getCacheHistory(Duration.ofHours(hours)));
  }

  /** Performance summary over recent monitor passes; 204 until the first pass has run. */
  @GetMapping("/cache/report")
  public ResponseEntity<PerformanceReport> cachePerformanceReport() {
    return healthService
        .getCachePerformanceReport()
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }
}
