package com.portfoliotracker.engine.infrastructure;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link ResultCache}. Expiry is checked against the clock on every read.
 */
@RequiredArgsConstructor
@Slf4j
public class InMemoryResultCache implements ResultCache {

    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }

        if (!clock.instant().isBefore(entry.expiresAt)) {
            entries.remove(key, entry);
            log.debug("Cache entry {} expired", key);
            return Optional.empty();
        }

        if (!type.isInstance(entry.value)) {
            log.warn("Cache entry {} holds {} but {} was requested",
                    key, entry.value.getClass().getSimpleName(), type.getSimpleName());
            return Optional.empty();
        }
        return Optional.of(type.cast(entry.value));
    }

    @Override
    public void set(String key, Object value, Duration ttl) {
        if (value == null || ttl.isNegative() || ttl.isZero()) {
            return;
        }
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public Optional<Duration> ttl(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        Duration remaining = Duration.between(clock.instant(), entry.expiresAt);
        return remaining.isNegative() || remaining.isZero() ? Optional.empty() : Optional.of(remaining);
    }

    @Override
    public void evict(String key) {
        entries.remove(key);
    }

    private static final class Entry {
        private final Object value;
        private final Instant expiresAt;

        private Entry(Object value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }
    }
}
