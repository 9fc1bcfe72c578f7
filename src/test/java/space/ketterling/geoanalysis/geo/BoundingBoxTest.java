package space.ketterling.geoanalysis.geo;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("BoundingBox Tests")
class BoundingBoxTest {

    @Test
    @DisplayName("Valid box has no problems")
    void testValid() {
        BoundingBox b = new BoundingBox(139.5, 35.5, 139.9, 35.8);
        assertTrue(b.isValid());
        assertEquals(0.4, b.widthDegrees(), 1e-9);
        assertEquals(0.3, b.heightDegrees(), 1e-9);
        assertEquals("[139.5, 35.5, 139.9, 35.8]", b.label());
    }

    @Test
    @DisplayName("All problems are reported together")
    void testProblems() {
        List<String> p = new BoundingBox(200, 10, 100, 5).problems();
        assertEquals(List.of(
                "Longitude must be between -180 and 180.",
                "West longitude must be less than east longitude.",
                "South latitude must be less than north latitude."), p);

        assertFalse(new BoundingBox(0, -91, 1, 0).isValid());
    }

    @Test
    @DisplayName("of() requires four values")
    void testOf() {
        assertEquals(new BoundingBox(1, 2, 3, 4), BoundingBox.of(new double[] { 1, 2, 3, 4 }));
        assertThrows(IllegalArgumentException.class, () -> BoundingBox.of(new double[] { 1, 2, 3 }));
    }

    @Test
    @DisplayName("expand pads both sides and clamps to the globe")
    void testExpand() {
        BoundingBox b = new BoundingBox(0, 0, 10, 10).expand();
        assertEquals(-0.5, b.west(), 1e-9);
        assertEquals(10.5, b.north(), 1e-9);

        BoundingBox edge = new BoundingBox(-180, -90, 180, 90).expand(50);
        assertEquals(new BoundingBox(-180, -90, 180, 90), edge);
    }

    @Test
    @DisplayName("Approximate area shrinks away from the equator")
    void testArea() {
        double equator = new BoundingBox(0, -0.5, 1, 0.5).approximateAreaKm2();
        double north = new BoundingBox(0, 59.5, 1, 60.5).approximateAreaKm2();
        assertEquals(111.0 * 111.0, equator, 1.0);
        assertTrue(north < equator * 0.51);
    }
}
