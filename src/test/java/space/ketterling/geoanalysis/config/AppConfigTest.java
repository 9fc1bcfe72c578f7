package space.ketterling.geoanalysis.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AppConfig Tests")
class AppConfigTest {

    @Test
    @DisplayName("Defaults apply when nothing is configured")
    void testDefaults() {
        AppConfig cfg = AppConfig.fromProperties(new Properties());
        assertEquals(8080, cfg.apiPort());
        assertFalse(cfg.exposeErrorDetails());
        assertEquals(100, cfg.cacheMaxEntries());
        assertEquals(Duration.ofHours(1), cfg.cacheTtl());
        assertEquals(4, cfg.workerPoolSize());
        assertEquals(Duration.ofSeconds(90), cfg.bucketTimeout());
        assertTrue(cfg.allowedDatasetIds().isEmpty());
        assertEquals(ZoneId.of("UTC"), cfg.clockZoneId());
    }

    @Test
    @DisplayName("Properties override defaults and lists are trimmed")
    void testProperties() {
        Properties p = new Properties();
        p.setProperty("guardrail.maxTimeRangeYears", "2.5");
        p.setProperty("guardrail.dataProducts", " vegetation, ,water ");
        p.setProperty("compute.baseUrl", "https://engine.internal:9443");
        p.setProperty("cache.ttl", "PT15M");

        AppConfig cfg = AppConfig.fromProperties(p);
        assertEquals(2.5, cfg.maxTimeRangeYears());
        assertEquals(List.of("vegetation", "water"), cfg.allowedDataProducts());
        assertEquals("https://engine.internal:9443", cfg.computeBaseUrl());
        assertEquals(Duration.ofMinutes(15), cfg.cacheTtl());
    }

    @Test
    @DisplayName("Pool and cache sizes must be at least one")
    void testInvalidSizes() {
        Properties p = new Properties();
        p.setProperty("workers.poolSize", "0");
        assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(p));

        Properties q = new Properties();
        q.setProperty("cache.maxEntries", "0");
        assertThrows(IllegalStateException.class, () -> AppConfig.fromProperties(q));
    }

    @Test
    @DisplayName("Bundled application.properties loads")
    void testLoad() {
        AppConfig cfg = AppConfig.load();
        assertTrue(cfg.apiPort() > 0);
        assertFalse(cfg.allowedAnalysisTypes().isEmpty());
    }
}
