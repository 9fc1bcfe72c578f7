package space.ketterling.geoanalysis.api;

import io.javalin.Javalin;
import space.ketterling.geoanalysis.pipeline.AnalysisArtifact;
import space.ketterling.geoanalysis.pipeline.CheckResult;

/**
 * Plan execution and dry-run endpoints.
 */
final class ApiRoutesAnalysis {

    /** Utility class; do not instantiate. */
    private ApiRoutesAnalysis() {
    }

    /**
     * Registers analysis run and check endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();

        app.post("/api/run", ctx -> {
            AnalysisArtifact artifact = api.pipeline().run(api.readPlan(ctx));
            ctx.json(artifact.toJson(api.om()));
        });

        // validation + guardrails only; never reaches the compute engine
        app.post("/api/check", ctx -> {
            CheckResult r = api.pipeline().check(api.readPlan(ctx));
            ctx.json(r.toJson(api.om()));
        });
    }
}
