package space.ketterling.geoanalysis.cache;

import java.time.Instant;

/**
 * One stored value. Hit count is mutated under the owning store's lock.
 */
final class CacheEntry<T> {
    final T value;
    final Instant createdAt;
    long hitCount;

    CacheEntry(T value, Instant createdAt) {
        this.value = value;
        this.createdAt = createdAt;
    }
}
