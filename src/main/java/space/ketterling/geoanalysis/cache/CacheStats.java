package space.ketterling.geoanalysis.cache;

/**
 * Point-in-time view of a cache.
 */
public record CacheStats(int size, int maxSize, long totalHits, double avgHits, double avgAgeSeconds) {
}
