package com.flamingo.ai.olivia.api.rest;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.olivia.cache.CacheMonitor;
import com.flamingo.ai.olivia.cache.CacheStats;
import com.flamingo.ai.olivia.cache.PerformanceReport;
import com.flamingo.ai.olivia.exception.GlobalExceptionHandler;
import com.flamingo.ai.olivia.service.health.HealthService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("HealthController Tests")
class HealthControllerTest {

  private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

  @Mock private HealthService healthService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new HealthController(healthService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should report the service as up")
  void shouldReportUp() throws Exception {
    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"));

    verifyNoInteractions(healthService);
  }

  @Test
  @DisplayName("Should return cache history for the requested hours")
  void shouldReturnCacheHistory() throws Exception {
    CacheStats stats = new CacheStats(5, 100, 8, 2, 3, 0, 0, 0.8, NOW);
    when(healthService.getCacheHistory(Duration.ofHours(6)))
        .thenReturn(List.of(new CacheMonitor.MetricsSnapshot(NOW, stats, 0.0)));

    mockMvc
        .perform(get("/health/cache/history").param("hours", "6"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0].stats.hitRate").value(0.8));
  }

  @Test
  @DisplayName("Should default the history window to one hour")
  void shouldDefaultHistoryWindow() throws Exception {
    when(healthService.getCacheHistory(Duration.ofHours(1))).thenReturn(List.of());

    mockMvc
        .perform(get("/health/cache/history"))
        .andExpect(status().isOk())
        .andExpect(content().json("[]"));
  }

  @Test
  @DisplayName("Should reject a non-positive history window")
  void shouldRejectNonPositiveHistoryWindow() throws Exception {
    when(healthService.getCacheHistory(Duration.ofHours(0)))
        .thenThrow(new IllegalArgumentException("History window must be positive"));

    mockMvc
        .perform(get("/health/cache/history").param("hours", "0"))
        .andExpect(status().isBadRequest());
  }

  @Test
  @DisplayName("Should return the performance report when available")
  void shouldReturnPerformanceReport() throws Exception {
    PerformanceReport report =
        new PerformanceReport(
            new PerformanceReport.Summary(0.5, 2, 0.4, 0.0, 40, 0),
            new PerformanceReport.Trends(0.25, 0.0, 3),
            List.of("Consider increasing cache TTL values"),
            new PerformanceReport.AlertSummary(0, Map.of(), null),
            NOW);
    when(healthService.getCachePerformanceReport()).thenReturn(Optional.of(report));

    mockMvc
        .perform(get("/health/cache/report"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.summary.snapshots").value(2))
        .andExpect(jsonPath("$.trends.memorySizeChange").value(3))
        .andExpect(jsonPath("$.recommendations.length()").value(1));
  }

  @Test
  @DisplayName("Should answer 204 before the first monitor pass")
  void shouldReturnNoContentWithoutHistory() throws Exception {
    when(healthService.getCachePerformanceReport()).thenReturn(Optional.empty());

    mockMvc.perform(get("/health/cache/report")).andExpect(status().isNoContent());
  }
}
