package space.ketterling.geoanalysis.api;

import io.javalin.Javalin;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root and health endpoints.
 */
final class ApiRoutesRoot {

    /** Utility class; do not instantiate. */
    private ApiRoutesRoot() {
    }

    /**
     * Registers the root and health endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();

        app.get("/", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("service", "geoanalysis");
            out.put("status", "ok");
            out.put("endpoints", List.of(
                    "POST /api/run",
                    "POST /api/check",
                    "GET /api/guardrails",
                    "GET /api/locations",
                    "GET /api/cache/stats",
                    "DELETE /api/cache",
                    "GET /api/metrics/external",
                    "GET /health"));
            ctx.json(out);
        });

        app.get("/health", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("status", "ok");
            out.put("time", OffsetDateTime.now(api.clock()).toString());
            out.put("cacheEntries", api.cache().stats().size());
            ctx.json(out);
        });
    }
}
