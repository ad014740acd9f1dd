package com.portfoliotracker.engine.infrastructure;

import java.time.Duration;
import java.util.Optional;

/**
 * Read-through cache for idempotent aggregate results. Entries expire after their TTL and
 * are never served past it.
 */
public interface ResultCache {

    /**
     * Get a live entry.
     *
     * @param key  the cache key
     * @param type the expected value type
     * @return the cached value, or empty if absent or expired
     */
    <T> Optional<T> get(String key, Class<T> type);

    /**
     * Store a value for {@code ttl}.
     */
    void set(String key, Object value, Duration ttl);

    /**
     * Remaining time to live of a live entry.
     */
    Optional<Duration> ttl(String key);

    /**
     * Remove an entry if present.
     */
    void evict(String key);
}
