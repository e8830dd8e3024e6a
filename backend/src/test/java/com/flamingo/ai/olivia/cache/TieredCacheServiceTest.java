package com.flamingo.ai.olivia.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flamingo.ai.olivia.config.CacheConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
@DisplayName("TieredCacheService Tests")
class TieredCacheServiceTest {

  @Mock private JdbcCacheTier durableTier;

  private MutableClock clock;
  private MemoryCacheTier memoryTier;
  private SimpleMeterRegistry meterRegistry;
  private TieredCacheService cacheService;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt(10_000_000L);
    memoryTier = new MemoryCacheTier(100, Duration.ofHours(1), clock);
    meterRegistry = new SimpleMeterRegistry();
    cacheService =
        new TieredCacheService(
            memoryTier, durableTier, new ObjectMapper(), new CacheConfig(), clock, meterRegistry);
  }

  @Nested
  @DisplayName("Reads")
  class Reads {

    @Test
    @DisplayName("Should serve memory hits without touching the durable tier")
    void shouldServeMemoryHit() {
      when(durableTier.set(anyString(), any(), any())).thenReturn(true);
      cacheService.set("k", "value");

      assertThat(cacheService.get("k", String.class)).contains("value");
      verify(durableTier, never()).get("k");
      assertThat(meterRegistry.counter("cache.hits", "tier", "memory").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should promote durable hits into memory with the remaining TTL")
    void shouldPromoteDurableHit() {
      when(durableTier.get("k"))
          .thenReturn(Optional.of(new CachedValue(new TextNode("durable"), 10_060_000L)));

      assertThat(cacheService.get("k", String.class)).contains("durable");

      assertThat(memoryTier.get("k"))
          .hasValueSatisfying(v -> assertThat(v.expiresAtMillis()).isEqualTo(10_060_000L));
      assertThat(meterRegistry.counter("cache.hits", "tier", "durable").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should report a miss when the durable tier fails")
    void shouldDegradeOnDurableFailure() {
      when(durableTier.get("k")).thenThrow(new DataAccessResourceFailureException("disk gone"));

      assertThat(cacheService.get("k", String.class)).isEmpty();

      CacheStats stats = cacheService.getStats();
      assertThat(stats.misses()).isEqualTo(1);
      assertThat(stats.errors()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should report a miss when the payload does not match the requested type")
    void shouldMissOnTypeMismatch() {
      memoryTier.set("k", new TextNode("not-a-number"), null);

      assertThat(cacheService.get("k", Integer.class)).isEmpty();
      assertThat(cacheService.getStats().errors()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should decode generic payloads through a type reference")
    void shouldDecodeGenericPayload() {
      when(durableTier.set(anyString(), any(), any())).thenReturn(true);
      cacheService.set("k", List.of(Map.of("name", "notes")));

      Optional<List<Map<String, Object>>> result =
          cacheService.get("k", new TypeReference<List<Map<String, Object>>>() {});

      assertThat(result)
          .hasValueSatisfying(list -> assertThat(list.get(0)).containsEntry("name", "notes"));
    }
  }

  @Nested
  @DisplayName("Writes")
  class Writes {

    @Test
    @DisplayName("Should succeed when only the memory tier accepts the write")
    void shouldSucceedWithMemoryOnly() {
      when(durableTier.set(anyString(), any(), any()))
          .thenThrow(new DataAccessResourceFailureException("locked"));

      assertThat(cacheService.set("k", "v", Duration.ofMinutes(1))).isTrue();
      assertThat(cacheService.get("k", String.class)).contains("v");
      assertThat(cacheService.getStats().errors()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should refuse null values")
    void shouldRefuseNull() {
      assertThat(cacheService.set("k", null)).isFalse();
      verify(durableTier, never()).set(anyString(), any(), any());
    }

    @Test
    @DisplayName("Should delete from both tiers")
    void shouldDeleteFromBothTiers() {
      memoryTier.set("k", new TextNode("v"), null);
      when(durableTier.delete("k")).thenReturn(true);

      assertThat(cacheService.delete("k")).isTrue();
      assertThat(memoryTier.get("k")).isEmpty();
      assertThat(cacheService.getStats().deletes()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should sum removals across tiers when clearing a prefix")
    void shouldClearPatternAcrossTiers() {
      memoryTier.set("vector:1:2:a", new TextNode("v"), null);
      when(durableTier.clearPattern("vector:1:2:")).thenReturn(3);

      assertThat(cacheService.clearPattern("vector:1:2:")).isEqualTo(4);
    }
  }

  @Nested
  @DisplayName("getOrSet")
  class GetOrSet {

    @Test
    @DisplayName("Should compute once and serve the cached value afterwards")
    void shouldComputeOnce() {
      when(durableTier.set(anyString(), any(), any())).thenReturn(true);
      AtomicInteger calls = new AtomicInteger();

      String first =
          cacheService.getOrSet(
              "k",
              String.class,
              Duration.ofMinutes(1),
              () -> "computed-" + calls.incrementAndGet());
      String second =
          cacheService.getOrSet(
              "k",
              String.class,
              Duration.ofMinutes(1),
              () -> "computed-" + calls.incrementAndGet());

      assertThat(first).isEqualTo("computed-1");
      assertThat(second).isEqualTo("computed-1");
      assertThat(calls).hasValue(1);
      verify(durableTier).set(eq("k"), any(), eq(Duration.ofMinutes(1)));
    }

    @Test
    @DisplayName("Should not cache a null computation")
    void shouldNotCacheNull() {
      assertThat(cacheService.getOrSet("k", String.class, null, () -> null)).isNull();
      verify(durableTier, never()).set(anyString(), any(), any());
    }
  }

  @Nested
  @DisplayName("Namespace helpers")
  class Namespaces {

    @Test
    @DisplayName("Should keep session data under the session prefix for a day")
    void shouldStoreSessionData() {
      when(durableTier.set(anyString(), any(), any())).thenReturn(true);

      assertThat(cacheService.setSessionData("abc", Map.of("step", 2))).isTrue();

      verify(durableTier).set(eq("session:abc"), any(), eq(Duration.ofHours(24)));
      long dayLater = 10_000_000L + Duration.ofHours(24).toMillis();
      assertThat(memoryTier.get("session:abc"))
          .hasValueSatisfying(v -> assertThat(v.expiresAtMillis()).isEqualTo(dayLater));
      assertThat(cacheService.getSessionData("abc"))
          .hasValueSatisfying(data -> assertThat(data).containsEntry("step", 2));

      clock.advance(Duration.ofHours(24));

      assertThat(cacheService.getSessionData("abc")).isEmpty();
    }

    @Test
    @DisplayName("Should keep translations per language pair for a week")
    void shouldStoreTranslationPerLanguagePair() {
      when(durableTier.set(anyString(), any(), any())).thenReturn(true);
      String key = CacheKeys.translation("en-de", "good morning");

      cacheService.setTranslation("en-de", "good morning", "guten Morgen");

      assertThat(key).startsWith("trans:en-de:");
      verify(durableTier).set(eq(key), any(), eq(Duration.ofDays(7)));
      assertThat(cacheService.getTranslation("en-de", "good morning")).contains("guten Morgen");
      assertThat(cacheService.getTranslation("en-fr", "good morning")).isEmpty();

      clock.advance(Duration.ofDays(6));
      assertThat(cacheService.getTranslation("en-de", "good morning")).contains("guten Morgen");

      clock.advance(Duration.ofDays(1));
      assertThat(cacheService.getTranslation("en-de", "good morning")).isEmpty();
    }

    @Test
    @DisplayName("Should store user settings for a day and drop them on invalidation")
    void shouldStoreAndInvalidateUserSettings() {
      when(durableTier.set(anyString(), any(), any())).thenReturn(true);
      when(durableTier.delete("user_settings:42")).thenReturn(true);

      cacheService.setUserSettings(42L, Map.of("theme", "dark"));

      verify(durableTier).set(eq("user_settings:42"), any(), eq(Duration.ofHours(24)));
      assertThat(cacheService.getUserSettings(42L))
          .hasValueSatisfying(settings -> assertThat(settings).containsEntry("theme", "dark"));

      assertThat(cacheService.invalidateUserSettings(42L)).isTrue();

      assertThat(memoryTier.get("user_settings:42")).isEmpty();
      assertThat(cacheService.getUserSettings(42L)).isEmpty();
    }

    @Test
    @DisplayName("Should expire user settings once their TTL has passed")
    void shouldExpireUserSettings() {
      when(durableTier.set(anyString(), any(), any())).thenReturn(true);
      cacheService.setUserSettings(42L, Map.of("theme", "dark"));

      clock.advance(Duration.ofHours(23));
      assertThat(cacheService.getUserSettings(42L)).isPresent();

      clock.advance(Duration.ofHours(1));
      assertThat(cacheService.getUserSettings(42L)).isEmpty();
    }
  }

  @Nested
  @DisplayName("Statistics and health")
  class StatsAndHealth {

    @Test
    @DisplayName("Should compute hit rate and reset counters")
    void shouldComputeHitRate() {
      memoryTier.set("hit", new TextNode("v"), null);
      cacheService.get("hit", String.class);
      cacheService.get("hit", String.class);
      cacheService.get("hit", String.class);
      cacheService.get("miss", String.class);

      CacheStats stats = cacheService.getStats();
      assertThat(stats.hits()).isEqualTo(3);
      assertThat(stats.misses()).isEqualTo(1);
      assertThat(stats.hitRate()).isEqualTo(0.75);
      assertThat(stats.memoryMaxSize()).isEqualTo(100);

      cacheService.resetMetrics();

      assertThat(cacheService.getStats().hits()).isZero();
      assertThat(cacheService.getStats().hitRate()).isZero();
    }

    @Test
    @DisplayName("Should report degraded health when the durable tier is unreachable")
    void shouldReportDegradedHealth() {
      when(durableTier.ping()).thenThrow(new DataAccessResourceFailureException("down"));

      CacheHealth health = cacheService.healthCheck();

      assertThat(health.status()).isEqualTo(CacheHealth.DEGRADED);
      assertThat(health.memoryAvailable()).isTrue();
      assertThat(health.durableAvailable()).isFalse();
    }

    @Test
    @DisplayName("Should report healthy when the durable tier answers")
    void shouldReportHealthy() {
      when(durableTier.ping()).thenReturn(true);

      assertThat(cacheService.healthCheck().status()).isEqualTo(CacheHealth.HEALTHY);
    }
  }
}
