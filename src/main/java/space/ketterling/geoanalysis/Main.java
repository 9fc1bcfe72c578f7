/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for geoanalysis, a guarded geospatial analysis service.
*
* Loads configuration, builds the compute engine client, geocoder, guardrails, result cache
* and workflows, then starts the API server. Handles a graceful shutdown of the server
* and the bucket worker pool.
*/

package space.ketterling.geoanalysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.geoanalysis.api.ApiServer;
import space.ketterling.geoanalysis.cache.CacheStore;
import space.ketterling.geoanalysis.cache.InMemoryCacheStore;
import space.ketterling.geoanalysis.compute.ComputeEngine;
import space.ketterling.geoanalysis.compute.ComputeEngineClient;
import space.ketterling.geoanalysis.config.AppConfig;
import space.ketterling.geoanalysis.geo.LocationResolver;
import space.ketterling.geoanalysis.geo.NominatimGeocoder;
import space.ketterling.geoanalysis.guardrail.GuardrailEngine;
import space.ketterling.geoanalysis.guardrail.GuardrailPolicy;
import space.ketterling.geoanalysis.pipeline.AnalysisArtifact;
import space.ketterling.geoanalysis.pipeline.AnalysisPipeline;
import space.ketterling.geoanalysis.plan.PlanValidator;
import space.ketterling.geoanalysis.workflow.ChangeDetectionExecutor;
import space.ketterling.geoanalysis.workflow.TimeSeriesExecutor;
import space.ketterling.geoanalysis.workflow.WorkflowRouter;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();
        Clock clock = Clock.system(cfg.clockZoneId());
        ObjectMapper om = new ObjectMapper();

        GuardrailPolicy policy = GuardrailPolicy.from(cfg);
        GuardrailEngine guardrails = new GuardrailEngine(policy, clock);
        CacheStore<AnalysisArtifact> cache = new InMemoryCacheStore<>(cfg.cacheMaxEntries(), cfg.cacheTtl(), clock);

        final LocationResolver resolver;
        if (cfg.geocoderEnabled()) {
            resolver = new LocationResolver(new NominatimGeocoder(cfg, om));
        } else {
            log.info("Geocoder disabled by config, using built-in locations only");
            resolver = new LocationResolver(null);
        }

        if (cfg.computeToken().isBlank())
            log.warn("No compute.token configured; compute engine calls are sent unauthenticated");
        ComputeEngine engine = new ComputeEngineClient(cfg, om);

        AtomicInteger workerSeq = new AtomicInteger();
        ExecutorService bucketPool = Executors.newFixedThreadPool(cfg.workerPoolSize(),
                r -> new Thread(r, "bucket-worker-" + workerSeq.incrementAndGet()));
        TimeSeriesExecutor timeSeries = new TimeSeriesExecutor(engine, bucketPool, cfg.bucketTimeout(),
                cfg.requestDeadline());
        ChangeDetectionExecutor change = new ChangeDetectionExecutor(engine);
        WorkflowRouter router = WorkflowRouter.standard(timeSeries, change);

        AnalysisPipeline pipeline = new AnalysisPipeline(new PlanValidator(om), guardrails, cache, resolver, router,
                clock);

        ApiServer api = new ApiServer(cfg, om, pipeline, policy, resolver, router, cache, clock);
        api.start();
        log.info("API server started on port {} (workflows: {})", cfg.apiPort(), router.supportedProducts());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                bucketPool.shutdown();
                if (!bucketPool.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.warn("Bucket workers did not terminate cleanly");
                    bucketPool.shutdownNow();
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                bucketPool.shutdownNow();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }
}
