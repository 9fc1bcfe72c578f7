package space.ketterling.geoanalysis.metrics;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ExternalApiMetrics Tests")
class ExternalApiMetricsTest {

    @BeforeEach
    void setUp() {
        ExternalApiMetrics.reset();
    }

    @AfterEach
    void tearDown() {
        ExternalApiMetrics.reset();
    }

    @Test
    @DisplayName("Status follows the failure rate")
    void testStatus() {
        for (int i = 0; i < 9; i++)
            ExternalApiMetrics.record(ExternalApiMetrics.COMPUTE, true, 100);
        ExternalApiMetrics.record(ExternalApiMetrics.COMPUTE, false, 200);
        ExternalApiMetrics.record(ExternalApiMetrics.NOMINATIM, true, 30);

        Map<String, ExternalApiMetrics.ServiceSnapshot> snap = ExternalApiMetrics.snapshot();
        ExternalApiMetrics.ServiceSnapshot compute = snap.get(ExternalApiMetrics.COMPUTE);
        assertEquals(10, compute.callsLastHour);
        assertEquals(1, compute.failuresLastHour);
        assertEquals(10.0, compute.failurePct, 1e-9);
        assertEquals(110.0, compute.avgLatencyMs, 1e-9);
        assertEquals("degraded", compute.status);
        assertEquals("ok", snap.get(ExternalApiMetrics.NOMINATIM).status);
    }

    @Test
    @DisplayName("Blank service names are ignored")
    void testBlankService() {
        ExternalApiMetrics.record(" ", true, 1);
        assertTrue(ExternalApiMetrics.snapshot().isEmpty());
    }
}
