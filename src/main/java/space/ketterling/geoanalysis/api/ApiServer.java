/*
* Copyright 2025 Taylor Ketterling
* API Server for geoanalysis, a guarded geospatial analysis service.
* Utilizes Javalin for the HTTP server and Jackson for JSON processing.
*/

package space.ketterling.geoanalysis.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.geoanalysis.AnalysisException;
import space.ketterling.geoanalysis.cache.CacheStore;
import space.ketterling.geoanalysis.compute.RemoteComputeException;
import space.ketterling.geoanalysis.config.AppConfig;
import space.ketterling.geoanalysis.geo.LocationNotFoundException;
import space.ketterling.geoanalysis.geo.LocationResolver;
import space.ketterling.geoanalysis.guardrail.GuardrailPolicy;
import space.ketterling.geoanalysis.guardrail.GuardrailViolationException;
import space.ketterling.geoanalysis.pipeline.AnalysisArtifact;
import space.ketterling.geoanalysis.pipeline.AnalysisPipeline;
import space.ketterling.geoanalysis.plan.PlanValidationException;
import space.ketterling.geoanalysis.workflow.NoValidDataException;
import space.ketterling.geoanalysis.workflow.UnsupportedWorkflowException;
import space.ketterling.geoanalysis.workflow.WorkflowRouter;

import java.time.Clock;

/**
 * HTTP front end for the analysis pipeline.
 *
 * <p>
 * Errors are always JSON {@code {error, message, details?}}; stack traces are
 * logged and never returned.
 * </p>
 */
public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final AnalysisPipeline pipeline;
    private final GuardrailPolicy policy;
    private final LocationResolver resolver;
    private final WorkflowRouter router;
    private final CacheStore<AnalysisArtifact> cache;
    private final Clock clock;
    private Javalin app;

    public ApiServer(AppConfig cfg, ObjectMapper om, AnalysisPipeline pipeline, GuardrailPolicy policy,
            LocationResolver resolver, WorkflowRouter router, CacheStore<AnalysisArtifact> cache, Clock clock) {
        this.cfg = cfg;
        this.om = om;
        this.pipeline = pipeline;
        this.policy = policy;
        this.resolver = resolver;
        this.router = router;
        this.cache = cache;
        this.clock = clock;
    }

    public void start() {
        log.info("Starting API server on port {}", cfg.apiPort());
        create().start(cfg.apiPort());
    }

    /**
     * Builds the configured (not yet started) Javalin app.
     */
    public Javalin create() {
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.info("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        });

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        app.exception(AnalysisException.class, (e, ctx) -> {
            int status = statusFor(e);
            if (status >= 500)
                log.warn("{} on {} {}: {}", e.errorCode(), ctx.method(), ctx.path(), e.getMessage());
            else
                log.info("{} on {} {}: {}", e.errorCode(), ctx.method(), ctx.path(), e.getMessage());
            ctx.status(status).json(errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ObjectNode body = om.createObjectNode()
                    .put("error", "internal_error")
                    .put("message", "An unexpected error occurred.");
            if (cfg.exposeErrorDetails())
                body.putObject("details").put("exception", String.valueOf(e.getMessage()));
            ctx.status(500).json(body);
        });

        ApiRoutesRoot.register(this);
        ApiRoutesAnalysis.register(this);
        ApiRoutesReference.register(this);
        ApiRoutesCache.register(this);
        ApiRoutesMetrics.register(this);
        return app;
    }

    public void stop() {
        if (app != null) {
            app.stop();
        }
    }

    static int statusFor(AnalysisException e) {
        if (e instanceof PlanValidationException || e instanceof UnsupportedWorkflowException)
            return 400;
        if (e instanceof GuardrailViolationException)
            return 422;
        if (e instanceof LocationNotFoundException || e instanceof NoValidDataException)
            return 404;
        if (e instanceof RemoteComputeException)
            return 502;
        return 500;
    }

    ObjectNode errorBody(AnalysisException e) {
        ObjectNode body = om.createObjectNode();
        body.put("error", e.errorCode());
        body.put("message", e.getMessage());
        if (e instanceof PlanValidationException) {
            ArrayNode fields = body.putObject("details").putArray("fields");
            for (PlanValidationException.FieldError fe : ((PlanValidationException) e).fieldErrors()) {
                fields.addObject().put("field", fe.field()).put("message", fe.message());
            }
        } else if (e instanceof GuardrailViolationException) {
            ArrayNode w = body.putObject("details").putArray("warnings");
            ((GuardrailViolationException) e).warnings().forEach(w::add);
        } else if (e instanceof LocationNotFoundException) {
            ArrayNode known = body.putObject("details").putArray("knownLocations");
            ((LocationNotFoundException) e).knownLocations().forEach(known::add);
        } else if (e instanceof UnsupportedWorkflowException) {
            ArrayNode s = body.putObject("details").putArray("supported");
            ((UnsupportedWorkflowException) e).supported().forEach(s::add);
        }
        return body;
    }

    /**
     * Reads the request body as a plan, accepting either the bare plan or
     * {@code {"plan": {...}}}.
     */
    JsonNode readPlan(Context ctx) {
        String raw = ctx.body();
        if (raw == null || raw.isBlank())
            throw PlanValidationException.of("$", "request body must contain an analysis plan");
        JsonNode root;
        try {
            root = om.readTree(raw);
        } catch (Exception e) {
            throw PlanValidationException.of("$", "plan is not valid JSON");
        }
        JsonNode wrapped = root.get("plan");
        return (wrapped != null && wrapped.isObject()) ? wrapped : root;
    }

    Javalin app() {
        return app;
    }

    ObjectMapper om() {
        return om;
    }

    AnalysisPipeline pipeline() {
        return pipeline;
    }

    GuardrailPolicy policy() {
        return policy;
    }

    LocationResolver resolver() {
        return resolver;
    }

    WorkflowRouter router() {
        return router;
    }

    CacheStore<AnalysisArtifact> cache() {
        return cache;
    }

    Clock clock() {
        return clock;
    }
}
