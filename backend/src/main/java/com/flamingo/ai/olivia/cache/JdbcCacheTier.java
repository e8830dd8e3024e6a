package com.flamingo.ai.olivia.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.olivia.config.CacheConfig;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Durable tier stored in a single relational table.
 *
 * <p>Schema: {@code cache_key} primary key, {@code cache_value} JSON text, {@code expires_at} epoch
 * millis (nullable, null never expires) and {@code created_at}. The table is created on first use;
 * concurrent first callers are serialized so the DDL runs once per process.
 *
 * <p>The SQL sticks to statements every mainstream JDBC database accepts, so the same tier works
 * against SQLite, PostgreSQL or H2.
 */
@Component
@Slf4j
public class JdbcCacheTier implements CacheTier {

  private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Duration defaultTtl;
  private final String tableName;

  private final ReentrantLock initLock = new ReentrantLock();
  private volatile boolean initialized;

  @Autowired
  public JdbcCacheTier(
      JdbcTemplate jdbcTemplate,
      ObjectMapper objectMapper,
      CacheConfig cacheConfig,
      Clock cacheClock) {
    this(
        jdbcTemplate,
        objectMapper,
        cacheClock,
        cacheConfig.getDefaultTtl(),
        cacheConfig.getTableName());
  }

  @VisibleForTesting
  public JdbcCacheTier(
      JdbcTemplate jdbcTemplate,
      ObjectMapper objectMapper,
      Clock clock,
      Duration defaultTtl,
      String tableName) {
    if (!TABLE_NAME.matcher(tableName).matches()) {
      throw new IllegalArgumentException("Invalid cache table name: " + tableName);
    }
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.defaultTtl = defaultTtl;
    this.tableName = tableName;
  }

  @Override
  public Optional<CachedValue> get(String key) {
    ensureTable();
    List<Row> rows =
        jdbcTemplate.query(
            "SELECT cache_value, expires_at FROM "
                + tableName
                + " WHERE cache_key = ? AND (expires_at IS NULL OR expires_at > ?)",
            (rs, rowNum) -> {
              long expiresAt = rs.getLong(2);
              return new Row(rs.getString(1), rs.wasNull() ? null : expiresAt);
            },
            key,
            clock.millis());
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    Row row = rows.get(0);
    try {
      return Optional.of(new CachedValue(objectMapper.readTree(row.json()), row.expiresAt()));
    } catch (JsonProcessingException e) {
      throw new CacheSerializationException("Malformed cached payload for key " + key, e);
    }
  }

  @Override
  public boolean set(String key, JsonNode value, Duration ttl) {
    ensureTable();
    String json;
    try {
      json = objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new CacheSerializationException("Cannot serialize value for key " + key, e);
    }
    long now = clock.millis();
    long expiresAt = now + (ttl != null ? ttl : defaultTtl).toMillis();

    if (update(key, json, expiresAt, now) > 0) {
      return true;
    }
    try {
      jdbcTemplate.update(
          "INSERT INTO "
              + tableName
              + " (cache_key, cache_value, expires_at, created_at) VALUES (?, ?, ?, ?)",
          key,
          json,
          expiresAt,
          now);
    } catch (DataIntegrityViolationException e) {
      // another writer inserted the key between our UPDATE and INSERT
      update(key, json, expiresAt, now);
    }
    return true;
  }

  @Override
  public boolean delete(String key) {
    ensureTable();
    return jdbcTemplate.update("DELETE FROM " + tableName + " WHERE cache_key = ?", key) > 0;
  }

  @Override
  public int clearPattern(String prefix) {
    ensureTable();
    return jdbcTemplate.update(
        "DELETE FROM " + tableName + " WHERE cache_key LIKE ? ESCAPE '\\'",
        escapeLike(prefix) + "%");
  }

  /**
   * Deletes rows whose expiry has passed.
   *
   * @return number of deleted rows
   */
  public int cleanupExpired() {
    ensureTable();
    int deleted =
        jdbcTemplate.update(
            "DELETE FROM " + tableName + " WHERE expires_at IS NOT NULL AND expires_at <= ?",
            clock.millis());
    if (deleted > 0) {
      log.info("Removed {} expired entries from {}", deleted, tableName);
    }
    return deleted;
  }

  /** Number of rows currently stored, expired or not. */
  public long count() {
    ensureTable();
    Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
    return count != null ? count : 0L;
  }

  /** Round-trips a trivial query to verify the store is reachable. */
  public boolean ping() {
    ensureTable();
    Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
    return one != null && one == 1;
  }

  private int update(String key, String json, long expiresAt, long now) {
    return jdbcTemplate.update(
        "UPDATE "
            + tableName
            + " SET cache_value = ?, expires_at = ?, created_at = ? WHERE cache_key = ?",
        json,
        expiresAt,
        now,
        key);
  }

  private void ensureTable() {
    if (initialized) {
      return;
    }
    initLock.lock();
    try {
      if (initialized) {
        return;
      }
      jdbcTemplate.execute(
          "CREATE TABLE IF NOT EXISTS "
              + tableName
              + " (cache_key VARCHAR(512) PRIMARY KEY,"
              + " cache_value TEXT NOT NULL,"
              + " expires_at BIGINT,"
              + " created_at BIGINT NOT NULL)");
      jdbcTemplate.execute(
          "CREATE INDEX IF NOT EXISTS idx_"
              + tableName
              + "_expires_at ON "
              + tableName
              + " (expires_at)");
      initialized = true;
      log.info("Durable cache table '{}' ready", tableName);
    } finally {
      initLock.unlock();
    }
  }

  private static String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private record Row(String json, Long expiresAt) {}
}
