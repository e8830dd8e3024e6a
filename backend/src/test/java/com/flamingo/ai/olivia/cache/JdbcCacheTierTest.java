package com.flamingo.ai.olivia.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

@DisplayName("JdbcCacheTier Tests")
class JdbcCacheTierTest {

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private MutableClock clock;
  private JdbcCacheTier tier;

  @BeforeEach
  void setUp() {
    DriverManagerDataSource dataSource =
        new DriverManagerDataSource("jdbc:sqlite:" + tempDir.resolve("cache.db"));
    dataSource.setDriverClassName("org.sqlite.JDBC");
    clock = MutableClock.startingAt(5_000_000L);
    tier =
        new JdbcCacheTier(
            new JdbcTemplate(dataSource), objectMapper, clock, Duration.ofHours(1), "test_cache");
  }

  @Test
  @DisplayName("Should reject table names that are not plain identifiers")
  void shouldRejectUnsafeTableName() {
    assertThatThrownBy(
            () ->
                new JdbcCacheTier(
                    new JdbcTemplate(), objectMapper, clock, Duration.ofHours(1), "x; DROP"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Should round-trip structured JSON payloads")
  void shouldStoreAndReadJson() {
    ObjectNode payload = objectMapper.createObjectNode().put("answer", "42").put("score", 0.9);

    tier.set("llm:1:2:abc", payload, Duration.ofMinutes(5));

    assertThat(tier.get("llm:1:2:abc"))
        .hasValueSatisfying(
            cached -> {
              assertThat(cached.value().get("answer").asText()).isEqualTo("42");
              assertThat(cached.expiresAtMillis()).isEqualTo(5_300_000L);
            });
  }

  @Test
  @DisplayName("Should overwrite an existing key instead of failing")
  void shouldOverwriteExistingKey() {
    tier.set("k", new TextNode("first"), null);
    tier.set("k", new TextNode("second"), null);

    assertThat(tier.get("k"))
        .hasValueSatisfying(v -> assertThat(v.value().asText()).isEqualTo("second"));
    assertThat(tier.count()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should hide expired rows and purge them on cleanup")
  void shouldExpireAndCleanup() {
    tier.set("short", new TextNode("a"), Duration.ofSeconds(10));
    tier.set("long", new TextNode("b"), Duration.ofHours(2));

    clock.advance(Duration.ofSeconds(10));

    assertThat(tier.get("short")).isEmpty();
    assertThat(tier.count()).isEqualTo(2);
    assertThat(tier.cleanupExpired()).isEqualTo(1);
    assertThat(tier.count()).isEqualTo(1);
    assertThat(tier.get("long")).isPresent();
  }

  @Test
  @DisplayName("Should treat LIKE wildcards in prefixes literally")
  void shouldEscapeLikeWildcards() {
    tier.set("user_collections:1", new TextNode("a"), null);
    tier.set("userXcollections:1", new TextNode("b"), null);

    int removed = tier.clearPattern("user_collections:");

    assertThat(removed).isEqualTo(1);
    assertThat(tier.get("userXcollections:1")).isPresent();
  }

  @Test
  @DisplayName("Should delete single keys and answer pings")
  void shouldDeleteAndPing() {
    tier.set("k", new TextNode("v"), null);

    assertThat(tier.delete("k")).isTrue();
    assertThat(tier.delete("k")).isFalse();
    assertThat(tier.ping()).isTrue();
  }
}
