package space.ketterling.geoanalysis.geo;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("NominatimGeocoder Tests")
class NominatimGeocoderTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    @DisplayName("boundingbox strings are reordered to west, south, east, north")
    void testParseFirstBox() throws Exception {
        String body = "[{\"display_name\":\"Lyon\",\"boundingbox\":[\"45.70\",\"45.81\",\"4.77\",\"4.90\"]},"
                + "{\"boundingbox\":[\"0\",\"1\",\"0\",\"1\"]}]";
        BoundingBox b = NominatimGeocoder.parseFirstBox(om.readTree(body), "Lyon");
        assertEquals(new BoundingBox(4.77, 45.70, 4.90, 45.81), b);
    }

    @Test
    @DisplayName("Empty results fail")
    void testNoResults() throws Exception {
        assertThrows(IllegalStateException.class,
                () -> NominatimGeocoder.parseFirstBox(om.readTree("[]"), "Nowhere"));
        assertThrows(IllegalStateException.class,
                () -> NominatimGeocoder.parseFirstBox(om.readTree("[{\"name\":\"x\"}]"), "x"));
    }
}
