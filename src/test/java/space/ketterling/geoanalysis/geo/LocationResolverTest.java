package space.ketterling.geoanalysis.geo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.geoanalysis.plan.PlanValidationException;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("LocationResolver Tests")
class LocationResolverTest {

    private static final BoundingBox PARIS = new BoundingBox(2.2, 48.8, 2.5, 48.9);

    @Test
    @DisplayName("Geocoded names are memoised")
    void testGeocodeMemo() {
        AtomicInteger calls = new AtomicInteger();
        LocationResolver r = new LocationResolver(name -> {
            calls.incrementAndGet();
            return PARIS;
        });

        assertEquals(PARIS, r.resolve(Location.named("Paris")));
        assertEquals(PARIS, r.resolve(Location.named(" Paris ")));
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Geocoder failure falls back to the built-in table")
    void testFallback() {
        AtomicInteger calls = new AtomicInteger();
        LocationResolver r = new LocationResolver(name -> {
            calls.incrementAndGet();
            throw new IllegalStateException("service down");
        });

        BoundingBox tokyo = r.resolve(Location.named("Tokyo"));
        assertEquals(new BoundingBox(139.5, 35.5, 139.9, 35.8), tokyo);
        r.resolve(Location.named("Tokyo"));
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Unusable geocoder box is treated as a failure")
    void testInvalidGeocoderBox() {
        LocationResolver r = new LocationResolver(name -> new BoundingBox(10, 0, 5, 1));
        assertEquals(new BoundingBox(139.5, 35.5, 139.9, 35.8), r.resolve(Location.named("Tokyo")));
    }

    @Test
    @DisplayName("Unknown names list every built-in location")
    void testNotFound() {
        LocationResolver r = new LocationResolver(null);
        LocationNotFoundException e = assertThrows(LocationNotFoundException.class,
                () -> r.resolve(Location.named("Atlantis")));

        assertEquals("Atlantis", e.locationName());
        assertEquals(r.knownLocations(), e.knownLocations());
        assertTrue(e.knownLocations().contains("Tokyo"));
        assertTrue(e.getMessage().contains("Known locations: "));
        assertEquals("location_not_found", e.errorCode());
    }

    @Test
    @DisplayName("Boxes pass through and are validated without a remote call")
    void testBoxes() {
        AtomicInteger calls = new AtomicInteger();
        LocationResolver r = new LocationResolver(name -> {
            calls.incrementAndGet();
            return PARIS;
        });

        BoundingBox box = new BoundingBox(1, 2, 3, 4);
        assertSame(box, r.resolve(Location.box(box)));

        PlanValidationException e = assertThrows(PlanValidationException.class,
                () -> r.resolve(Location.box(new BoundingBox(3, 2, 3, 4))));
        assertEquals("location", e.fieldErrors().get(0).field());
        assertEquals("West longitude must be less than east longitude.", e.fieldErrors().get(0).message());
        assertEquals(0, calls.get());
    }
}
