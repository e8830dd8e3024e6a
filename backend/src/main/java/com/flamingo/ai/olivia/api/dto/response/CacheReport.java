package com.flamingo.ai.olivia.api.dto.response;

import com.flamingo.ai.olivia.cache.CacheHealth;
import com.flamingo.ai.olivia.cache.CacheMonitor;
import com.flamingo.ai.olivia.cache.CacheStats;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Cache statistics, health and recent alerts, plus retrieval quality. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheReport {
  private CacheStats stats;
  private CacheHealth health;
  private List<CacheMonitor.Alert> recentAlerts;
  private Map<String, Object> retrievalQuality;
  private boolean semanticCacheEnabled;
  private Instant timestamp;
}
