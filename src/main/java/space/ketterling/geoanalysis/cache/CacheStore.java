package space.ketterling.geoanalysis.cache;

import java.util.Optional;

/**
 * Keyed store for finished artifacts.
 */
public interface CacheStore<T> {

    /**
     * Returns the live value and counts a hit; expired entries are dropped.
     */
    Optional<T> get(String key);

    void set(String key, T value);

    /**
     * Like {@link #get} but does not count a hit.
     */
    boolean has(String key);

    boolean delete(String key);

    /**
     * @return number of entries removed
     */
    int clear();

    CacheStats stats();
}
