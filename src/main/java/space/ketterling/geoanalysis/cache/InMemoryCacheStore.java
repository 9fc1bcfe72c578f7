package space.ketterling.geoanalysis.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded, TTL-based cache held in process memory.
 *
 * <p>
 * When full, inserting a new key evicts the entry created longest ago (ties go
 * to the one inserted first). Contents are lost on restart and are not shared
 * between instances.
 * </p>
 */
public final class InMemoryCacheStore<T> implements CacheStore<T> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);

    public static final int DEFAULT_MAX_ENTRIES = 100;
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private final Map<String, CacheEntry<T>> entries = new LinkedHashMap<>();
    private final int maxEntries;
    private final Duration ttl;
    private final Clock clock;

    public InMemoryCacheStore(int maxEntries, Duration ttl, Clock clock) {
        if (maxEntries < 1)
            throw new IllegalArgumentException("maxEntries must be at least 1");
        if (ttl == null || ttl.isNegative() || ttl.isZero())
            throw new IllegalArgumentException("ttl must be positive");
        this.maxEntries = maxEntries;
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public InMemoryCacheStore(Clock clock) {
        this(DEFAULT_MAX_ENTRIES, DEFAULT_TTL, clock);
    }

    @Override
    public synchronized Optional<T> get(String key) {
        CacheEntry<T> e = liveEntry(key);
        if (e == null)
            return Optional.empty();
        e.hitCount++;
        log.debug("Cache HIT {} (hits={}, age={}s)", key, e.hitCount, ageOf(e).toSeconds());
        return Optional.of(e.value);
    }

    @Override
    public synchronized void set(String key, T value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (entries.remove(key) == null && entries.size() >= maxEntries) {
            evictOldest();
        }
        entries.put(key, new CacheEntry<>(value, clock.instant()));
        log.debug("Cache SET {} (size={}/{})", key, entries.size(), maxEntries);
    }

    @Override
    public synchronized boolean has(String key) {
        return liveEntry(key) != null;
    }

    @Override
    public synchronized boolean delete(String key) {
        boolean removed = entries.remove(key) != null;
        if (removed)
            log.debug("Cache DELETE {}", key);
        return removed;
    }

    @Override
    public synchronized int clear() {
        int n = entries.size();
        entries.clear();
        log.info("Cache cleared, removed {} entries", n);
        return n;
    }

    @Override
    public synchronized CacheStats stats() {
        int size = entries.size();
        long totalHits = 0L;
        double totalAgeSeconds = 0.0;
        for (CacheEntry<T> e : entries.values()) {
            totalHits += e.hitCount;
            totalAgeSeconds += ageOf(e).toMillis() / 1000.0;
        }
        double avgHits = size == 0 ? 0.0 : (double) totalHits / size;
        double avgAge = size == 0 ? 0.0 : totalAgeSeconds / size;
        return new CacheStats(size, maxEntries, totalHits, avgHits, avgAge);
    }

    private CacheEntry<T> liveEntry(String key) {
        CacheEntry<T> e = entries.get(key);
        if (e == null)
            return null;
        if (ageOf(e).compareTo(ttl) > 0) {
            entries.remove(key);
            log.debug("Cache EXPIRED {}", key);
            return null;
        }
        return e;
    }

    private void evictOldest() {
        String oldestKey = null;
        Instant oldest = null;
        // strict comparison keeps the first-inserted entry on ties
        for (Map.Entry<String, CacheEntry<T>> e : entries.entrySet()) {
            if (oldest == null || e.getValue().createdAt.isBefore(oldest)) {
                oldest = e.getValue().createdAt;
                oldestKey = e.getKey();
            }
        }
        if (oldestKey != null) {
            entries.remove(oldestKey);
            log.debug("Cache EVICTED {} (created {})", oldestKey, oldest);
        }
    }

    private Duration ageOf(CacheEntry<T> e) {
        return Duration.between(e.createdAt, clock.instant());
    }
}
