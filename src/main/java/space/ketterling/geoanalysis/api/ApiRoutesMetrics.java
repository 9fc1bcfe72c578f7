package space.ketterling.geoanalysis.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.geoanalysis.metrics.ExternalApiMetrics;

/**
 * Health of the remote services this process depends on.
 */
final class ApiRoutesMetrics {

    /** Utility class; do not instantiate. */
    private ApiRoutesMetrics() {
    }

    /**
     * Registers external service metric endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/metrics/external", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("window_minutes", ExternalApiMetrics.windowMinutes());
            ArrayNode services = out.putArray("services");

            var snapshots = ExternalApiMetrics.snapshot();
            for (var e : snapshots.entrySet()) {
                var snap = e.getValue();
                ObjectNode row = om.createObjectNode();
                row.put("service", e.getKey());
                row.put("calls_last_hour", snap.callsLastHour);
                row.put("failures_last_hour", snap.failuresLastHour);
                row.put("failure_pct", snap.failurePct);
                row.put("avg_latency_ms", snap.avgLatencyMs);
                row.put("status", snap.status);
                services.add(row);
            }

            ctx.json(out);
        });
    }
}
