package com.flamingo.ai.olivia.cache;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A value read from one cache tier.
 *
 * @param value the JSON payload
 * @param expiresAtMillis absolute expiry in epoch millis, or {@code null} when the entry never
 *     expires
 */
public record CachedValue(JsonNode value, Long expiresAtMillis) {}
