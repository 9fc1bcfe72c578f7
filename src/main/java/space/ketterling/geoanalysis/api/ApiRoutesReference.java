package space.ketterling.geoanalysis.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.geoanalysis.guardrail.GuardrailPolicy;
import space.ketterling.geoanalysis.plan.AnalysisType;
import space.ketterling.geoanalysis.plan.DataProduct;
import space.ketterling.geoanalysis.plan.DatasetId;

/**
 * Read-only reference data: guardrail limits and built-in locations.
 */
final class ApiRoutesReference {

    /** Utility class; do not instantiate. */
    private ApiRoutesReference() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/guardrails", ctx -> {
            GuardrailPolicy p = api.policy();
            ObjectNode out = om.createObjectNode();
            out.put("maxTimeRangeYears", p.maxTimeRangeYears());
            out.put("maxAoiDegrees", p.maxAoiDegrees());
            ArrayNode types = out.putArray("allowedAnalysisTypes");
            p.allowedAnalysisTypes().stream().map(AnalysisType::wireName).forEach(types::add);
            ArrayNode products = out.putArray("allowedDataProducts");
            p.allowedDataProducts().stream().map(DataProduct::wireName).forEach(products::add);
            ArrayNode datasets = out.putArray("allowedDatasetIds");
            p.allowedDatasetIds().stream().map(DatasetId::catalogId).forEach(datasets::add);
            ArrayNode workflows = out.putArray("supportedWorkflows");
            api.router().supportedProducts().forEach(workflows::add);
            ctx.json(out);
        });

        app.get("/api/locations", ctx -> {
            ObjectNode out = om.createObjectNode();
            ArrayNode names = out.putArray("locations");
            api.resolver().knownLocations().forEach(names::add);
            ctx.json(out);
        });
    }
}
