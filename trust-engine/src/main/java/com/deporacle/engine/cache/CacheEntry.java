package com.deporacle.engine.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A single persisted cache record.
 *
 * @param value      the cached JSON payload
 * @param createdAt  creation time in epoch seconds
 * @param ttlSeconds lifetime in seconds
 *
 * @author Naveed Gung
 */
public record CacheEntry(JsonNode value, long createdAt, long ttlSeconds) {

    /** An entry is logically absent once more than {@code ttlSeconds} have elapsed. */
    public boolean isExpired(long nowEpochSeconds) {
        return nowEpochSeconds - createdAt > ttlSeconds;
    }

    public Instant createdInstant() {
        return Instant.ofEpochSecond(createdAt);
    }
}
