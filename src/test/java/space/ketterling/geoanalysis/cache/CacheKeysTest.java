package space.ketterling.geoanalysis.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.geo.Location;
import space.ketterling.geoanalysis.plan.*;
import space.ketterling.geoanalysis.testing.TestPlans;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("CacheKeys Tests")
class CacheKeysTest {

    private static AnalysisPlan airQuality(Location loc, String start, String end, DatasetId... ids) {
        return TestPlans.plan(AnalysisType.TIMESERIES, DataProduct.AIR_QUALITY, start, end, loc, ids);
    }

    @Test
    @DisplayName("Key format is namespace plus 16 hex chars")
    void testFormat() {
        String key = CacheKeys.analysisKey(TestPlans.temperatureSeries("2024-01-01", "2024-06-30"));
        assertTrue(key.matches("analysis:[0-9a-f]{16}"), key);
    }

    @Test
    @DisplayName("Dataset order and duplicates do not change the key")
    void testDatasetPermutation() {
        Location tokyo = Location.named("Tokyo");
        String a = CacheKeys.analysisKey(airQuality(tokyo, "2024-01-01", "2024-03-01", DatasetId.S5P_NO2,
                DatasetId.S5P_CO));
        String b = CacheKeys.analysisKey(airQuality(tokyo, "2024-01-01", "2024-03-01", DatasetId.S5P_CO,
                DatasetId.S5P_NO2, DatasetId.S5P_CO));
        assertEquals(a, b);
    }

    @Test
    @DisplayName("Location and time range are part of the key")
    void testDistinctInputs() {
        Location tokyo = Location.named("Tokyo");
        String base = CacheKeys.analysisKey(airQuality(tokyo, "2024-01-01", "2024-03-01", DatasetId.S5P_NO2));

        assertNotEquals(base, CacheKeys.analysisKey(airQuality(Location.named("Osaka"), "2024-01-01",
                "2024-03-01", DatasetId.S5P_NO2)));
        assertNotEquals(base, CacheKeys.analysisKey(airQuality(tokyo, "2024-01-01", "2024-03-02",
                DatasetId.S5P_NO2)));
        assertNotEquals(base, CacheKeys.analysisKey(airQuality(Location.box(TestPlans.TOKYO_BOX), "2024-01-01",
                "2024-03-01", DatasetId.S5P_NO2)));
    }

    @Test
    @DisplayName("Canonical material has a fixed field order")
    void testCanonicalJson() {
        AnalysisPlan plan = TestPlans.plan(AnalysisType.CHANGE, DataProduct.WATER, "2020-01-01", "2021-01-01",
                Location.box(new BoundingBox(1, 2, 3, 4)), DatasetId.GLOBAL_SURFACE_WATER);
        assertEquals("{\"analysisType\":\"change\",\"datasets\":[\"JRC/GSW1_4/GlobalSurfaceWater\"],"
                + "\"timeRange\":{\"start\":\"2020-01-01\",\"end\":\"2021-01-01\"},\"location\":[1.0,2.0,3.0,4.0]}",
                CacheKeys.canonicalJson(plan));
    }

    @Test
    @DisplayName("Keys parse into namespace and hash")
    void testParse() {
        String key = CacheKeys.explanationKey("analysis:0123456789abcdef", "why so green?");
        CacheKeys.ParsedKey parsed = CacheKeys.parse(key);
        assertEquals(CacheKeys.EXPLANATION, parsed.namespace());
        assertEquals(16, parsed.hash().length());

        assertThrows(IllegalArgumentException.class, () -> CacheKeys.parse("nocolon"));
    }
}
