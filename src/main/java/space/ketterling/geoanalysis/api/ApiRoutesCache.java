package space.ketterling.geoanalysis.api;

import io.javalin.Javalin;
import space.ketterling.geoanalysis.cache.CacheStats;

/**
 * Result cache inspection and reset.
 */
final class ApiRoutesCache {

    /** Utility class; do not instantiate. */
    private ApiRoutesCache() {
    }

    /**
     * Registers cache endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();

        app.get("/api/cache/stats", ctx -> {
            CacheStats s = api.cache().stats();
            ctx.json(api.om().createObjectNode()
                    .put("size", s.size())
                    .put("maxSize", s.maxSize())
                    .put("totalHits", s.totalHits())
                    .put("avgHits", s.avgHits())
                    .put("avgAgeSeconds", s.avgAgeSeconds()));
        });

        app.delete("/api/cache", ctx -> {
            int removed = api.cache().clear();
            ctx.json(api.om().createObjectNode().put("cleared", removed));
        });
    }
}
