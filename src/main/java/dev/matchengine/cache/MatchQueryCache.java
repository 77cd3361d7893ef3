package dev.matchengine.cache;

import dev.matchengine.model.MatchResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded LRU cache of ranked results.
 * <p>
 * Entries are kept in access order behind one lock so recency stays exact
 * under concurrent use. Entries keyed to an older weight version are never
 * looked up again and age out through normal eviction.
 */
@Slf4j
public class MatchQueryCache {

    private final int maxEntries;
    private final Duration ttl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong evictions = new AtomicLong();
    private final LinkedHashMap<CacheKey, Entry> entries;

    private record Entry(List<MatchResult> results, Instant storedAt) {
    }

    public MatchQueryCache(int maxEntries, Duration ttl, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("Cache capacity must be at least 1, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.ttl = ttl;
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<CacheKey, Entry> eldest) {
                boolean evict = size() > MatchQueryCache.this.maxEntries;
                if (evict) {
                    evictions.incrementAndGet();
                    log.debug("Evicting cached ranking {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    /**
     * Look up a ranking, refreshing its recency.
     *
     * @param maxAge freshness bound for this lookup; null uses the configured TTL
     * @return the cached list, or empty on a miss or a stale entry
     */
    public Optional<List<MatchResult>> get(CacheKey key, Duration maxAge) {
        lock.lock();
        try {
            Entry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (isExpired(entry, maxAge)) {
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(entry.results());
        } finally {
            lock.unlock();
        }
    }

    public Optional<List<MatchResult>> get(CacheKey key) {
        return get(key, null);
    }

    /**
     * True when a fresh entry exists. Counts as an access for recency.
     */
    public boolean containsFresh(CacheKey key, Duration maxAge) {
        lock.lock();
        try {
            Entry entry = entries.get(key);
            return entry != null && !isExpired(entry, maxAge);
        } finally {
            lock.unlock();
        }
    }

    public void put(CacheKey key, List<MatchResult> results) {
        Entry entry = new Entry(List.copyOf(results), clock.instant());
        lock.lock();
        try {
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            int size = entries.size();
            entries.clear();
            log.info("Match cache cleared ({} entries)", size);
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

    public long evictionCount() {
        return evictions.get();
    }

    public int capacity() {
        return maxEntries;
    }

    private boolean isExpired(Entry entry, Duration maxAge) {
        Duration bound = maxAge != null ? maxAge : ttl;
        if (bound == null || bound.isZero()) {
            return false;
        }
        return entry.storedAt().plus(bound).isBefore(clock.instant());
    }
}
