package space.ketterling.geoanalysis.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.geoanalysis.testing.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("InMemoryCacheStore Tests")
class InMemoryCacheStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));

    @Test
    @DisplayName("Inserting past capacity evicts the oldest entry")
    void testEviction() {
        InMemoryCacheStore<String> store = new InMemoryCacheStore<>(3, Duration.ofHours(1), clock);
        store.set("a", "1");
        clock.advance(Duration.ofSeconds(1));
        store.set("b", "2");
        clock.advance(Duration.ofSeconds(1));
        store.set("c", "3");
        clock.advance(Duration.ofSeconds(1));
        store.set("d", "4");

        assertFalse(store.has("a"));
        assertTrue(store.has("b"));
        assertTrue(store.has("d"));
        assertEquals(3, store.stats().size());
    }

    @Test
    @DisplayName("Ties in age evict the first inserted")
    void testEvictionTie() {
        InMemoryCacheStore<String> store = new InMemoryCacheStore<>(2, Duration.ofHours(1), clock);
        store.set("a", "1");
        store.set("b", "2");
        store.set("c", "3");
        assertFalse(store.has("a"));
        assertTrue(store.has("b"));
    }

    @Test
    @DisplayName("Overwriting a key never evicts another")
    void testOverwrite() {
        InMemoryCacheStore<String> store = new InMemoryCacheStore<>(2, Duration.ofHours(1), clock);
        store.set("a", "1");
        store.set("b", "2");
        store.set("a", "1b");
        assertEquals(Optional.of("1b"), store.get("a"));
        assertTrue(store.has("b"));
    }

    @Test
    @DisplayName("Entries older than the TTL are gone")
    void testTtl() {
        InMemoryCacheStore<String> store = new InMemoryCacheStore<>(clock);
        store.set("k", "v");
        clock.advance(Duration.ofHours(1));
        assertTrue(store.has("k"));
        clock.advance(Duration.ofMillis(1));
        assertFalse(store.has("k"));
        assertEquals(Optional.empty(), store.get("k"));
        assertEquals(0, store.stats().size());
    }

    @Test
    @DisplayName("Stats count hits from get but not from has")
    void testStats() {
        InMemoryCacheStore<String> store = new InMemoryCacheStore<>(clock);
        store.set("a", "1");
        store.set("b", "2");
        store.get("a");
        store.get("a");
        store.has("b");
        clock.advance(Duration.ofSeconds(10));

        CacheStats s = store.stats();
        assertEquals(2, s.size());
        assertEquals(100, s.maxSize());
        assertEquals(2, s.totalHits());
        assertEquals(1.0, s.avgHits(), 1e-9);
        assertEquals(10.0, s.avgAgeSeconds(), 1e-9);
    }

    @Test
    @DisplayName("delete and clear report what they removed")
    void testDeleteAndClear() {
        InMemoryCacheStore<String> store = new InMemoryCacheStore<>(clock);
        store.set("a", "1");
        store.set("b", "2");
        assertTrue(store.delete("a"));
        assertFalse(store.delete("a"));
        assertEquals(1, store.clear());
        assertEquals(0, store.stats().size());
    }
}
