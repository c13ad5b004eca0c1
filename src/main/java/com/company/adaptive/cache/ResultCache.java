package com.company.adaptive.cache;

import com.company.adaptive.domain.CacheEntry;
import com.company.adaptive.dto.response.CacheStatsResponse;
import com.company.adaptive.exception.ConfigurationException;
import com.company.adaptive.exception.InvalidRequestException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Short-term result cache partitioned by scope.
 *
 * <p>A single access-ordered map holds every scope, so capacity is global and the
 * least-recently-accessed entry is evicted first regardless of the scope it belongs to.
 * Expired entries are removed lazily on {@link #get} and actively by {@link #cleanup()};
 * neither path ever hands out an expired value.
 *
 * <p>Every invalidation advances the scope's generation. A caller that computes a value
 * outside the lock reads {@link #generation} first and stores with {@link #setIfCurrent},
 * so a result computed before a write cannot land in the cache after the write cleared it.
 */
@Slf4j
public class ResultCache {

    private final int maxEntries;
    private final Duration defaultTtl;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    // access order: iteration starts at the least recently accessed entry
    private final LinkedHashMap<EntryKey, CacheEntry> entries;
    private final Map<String, Long> generations = new HashMap<>();

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public ResultCache(int maxEntries, Duration defaultTtl, Clock clock) {
        if (maxEntries <= 0) {
            throw new ConfigurationException("Cache maxEntries must be positive, got " + maxEntries);
        }
        if (defaultTtl == null || defaultTtl.isZero() || defaultTtl.isNegative()) {
            throw new ConfigurationException("Cache default TTL must be positive, got " + defaultTtl);
        }
        this.maxEntries = maxEntries;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
        this.entries = new LinkedHashMap<>(Math.min(maxEntries, 1024), 0.75f, true);
    }

    public Optional<Object> get(String scope, String key) {
        EntryKey entryKey = keyOf(scope, key);
        Instant now = clock.instant();

        lock.lock();
        try {
            CacheEntry entry = entries.get(entryKey);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(entryKey);
                expirations++;
                misses++;
                return Optional.empty();
            }
            hits++;
            return Optional.ofNullable(entry.access(now));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a value, replacing any previous value under the same key.
     *
     * @param ttl time to live; null applies the default TTL
     */
    public void set(String scope, String key, Object value, Duration ttl) {
        EntryKey entryKey = keyOf(scope, key);
        CacheEntry entry = newEntry(scope, key, value, resolveTtl(ttl));

        lock.lock();
        try {
            put(entryKey, entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a value only if the scope has not been invalidated since {@code generation}
     * was read.
     *
     * @return true if the value was stored
     */
    public boolean setIfCurrent(String scope, String key, Object value, Duration ttl, long generation) {
        EntryKey entryKey = keyOf(scope, key);
        CacheEntry entry = newEntry(scope, key, value, resolveTtl(ttl));

        lock.lock();
        try {
            if (generations.getOrDefault(scope, 0L) != generation) {
                log.debug("Dropped stale fill for scope {}, invalidated while computing", scope);
                return false;
            }
            put(entryKey, entry);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current invalidation generation of a scope.
     */
    public long generation(String scope) {
        requireText(scope, "scope");
        lock.lock();
        try {
            return generations.getOrDefault(scope, 0L);
        } finally {
            lock.unlock();
        }
    }

    public boolean invalidate(String scope, String key) {
        EntryKey entryKey = keyOf(scope, key);
        lock.lock();
        try {
            generations.merge(scope, 1L, Long::sum);
            return entries.remove(entryKey) != null;
        } finally {
            lock.unlock();
        }
    }

    public int invalidateScope(String scope) {
        requireText(scope, "scope");
        lock.lock();
        try {
            generations.merge(scope, 1L, Long::sum);
            int removed = 0;
            Iterator<EntryKey> it = entries.keySet().iterator();
            while (it.hasNext()) {
                if (it.next().scope().equals(scope)) {
                    it.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                log.debug("Invalidated {} cache entries for scope {}", removed, scope);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        Instant now = clock.instant();
        lock.lock();
        try {
            int removed = 0;
            Iterator<CacheEntry> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            expirations += removed;
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Statistics for one scope, or for the whole cache when scope is null.
     * Hit/miss/eviction counters are cache-wide.
     */
    public CacheStatsResponse stats(String scope) {
        Instant now = clock.instant();
        lock.lock();
        try {
            int total = 0;
            int expired = 0;
            long accesses = 0;
            for (CacheEntry entry : entries.values()) {
                if (scope != null && !scope.equals(entry.getScope())) {
                    continue;
                }
                total++;
                if (entry.isExpired(now)) {
                    expired++;
                }
                accesses += entry.getAccessCount();
            }
            return CacheStatsResponse.builder()
                    .scope(scope)
                    .totalEntries(total)
                    .expiredEntries(expired)
                    .activeEntries(total - expired)
                    .totalAccesses(accesses)
                    .hits(hits)
                    .misses(misses)
                    .evictions(evictions)
                    .expirations(expirations)
                    .maxEntries(maxEntries)
                    .defaultTtlSeconds(defaultTtl.toSeconds())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    private CacheEntry newEntry(String scope, String key, Object value, Duration ttl) {
        Instant now = clock.instant();
        return CacheEntry.builder()
                .scope(scope)
                .key(key)
                .value(value)
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .lastAccessedAt(now)
                .build();
    }

    // caller holds the lock
    private void put(EntryKey entryKey, CacheEntry entry) {
        if (!entries.containsKey(entryKey)) {
            evictIfFull();
        }
        entries.put(entryKey, entry);
    }

    // caller holds the lock
    private void evictIfFull() {
        while (entries.size() >= maxEntries) {
            Iterator<Map.Entry<EntryKey, CacheEntry>> it = entries.entrySet().iterator();
            Map.Entry<EntryKey, CacheEntry> eldest = it.next();
            it.remove();
            evictions++;
            log.debug("Evicted least recently used entry {} (scope {})",
                    eldest.getKey().key(), eldest.getKey().scope());
        }
    }

    private Duration resolveTtl(Duration ttl) {
        if (ttl == null) {
            return defaultTtl;
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new InvalidRequestException("TTL must be positive, got " + ttl);
        }
        return ttl;
    }

    private static EntryKey keyOf(String scope, String key) {
        requireText(scope, "scope");
        requireText(key, "key");
        return new EntryKey(scope, key);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException("Cache " + name + " must not be blank");
        }
    }

    private record EntryKey(String scope, String key) {
        EntryKey {
            Objects.requireNonNull(scope);
            Objects.requireNonNull(key);
        }
    }
}
