package space.ketterling.geoanalysis.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.geoanalysis.cache.CacheKeys;
import space.ketterling.geoanalysis.cache.CacheStore;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.geo.LocationResolver;
import space.ketterling.geoanalysis.guardrail.GuardrailEngine;
import space.ketterling.geoanalysis.guardrail.GuardrailResult;
import space.ketterling.geoanalysis.plan.AnalysisPlan;
import space.ketterling.geoanalysis.plan.PlanValidator;
import space.ketterling.geoanalysis.stats.SeriesStatistics;
import space.ketterling.geoanalysis.stats.StatisticsAggregator;
import space.ketterling.geoanalysis.workflow.Attribution;
import space.ketterling.geoanalysis.workflow.WorkflowExecutor;
import space.ketterling.geoanalysis.workflow.WorkflowResult;
import space.ketterling.geoanalysis.workflow.WorkflowRouter;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs a raw plan through validation, guardrails, the cache, location
 * resolution, the matching workflow and statistics.
 */
public final class AnalysisPipeline {
    private static final Logger log = LoggerFactory.getLogger(AnalysisPipeline.class);
    static final String MDC_KEY = "analysis";

    private final PlanValidator validator;
    private final GuardrailEngine guardrails;
    private final CacheStore<AnalysisArtifact> cache;
    private final LocationResolver resolver;
    private final WorkflowRouter router;
    private final Clock clock;

    public AnalysisPipeline(PlanValidator validator, GuardrailEngine guardrails, CacheStore<AnalysisArtifact> cache,
            LocationResolver resolver, WorkflowRouter router, Clock clock) {
        this.validator = validator;
        this.guardrails = guardrails;
        this.cache = cache;
        this.resolver = resolver;
        this.router = router;
        this.clock = clock;
    }

    public AnalysisArtifact run(JsonNode rawPlan) {
        AnalysisPlan plan = validator.validate(rawPlan);
        String key = CacheKeys.analysisKey(plan);
        MDC.put(MDC_KEY, key);
        try {
            GuardrailResult verdict = guardrails.enforce(plan);

            Optional<AnalysisArtifact> hit = cache.get(key);
            if (hit.isPresent()) {
                log.info("Returning cached result");
                return hit.get().asCached();
            }

            long t0 = clock.millis();
            BoundingBox region = resolver.resolve(plan.location());
            WorkflowExecutor workflow = router.resolve(plan.dataProduct());
            log.info("Executing {} {} over {} ({})", plan.dataProduct().wireName(), plan.analysisType().wireName(),
                    region.label(), plan.timeRange());
            WorkflowResult result = workflow.execute(plan, region);

            SeriesStatistics stats = result.timeSeriesOpt()
                    .filter(ts -> !ts.isEmpty())
                    .map(StatisticsAggregator::summarize)
                    .orElse(null);
            String dateRange = plan.timeRange().toString();
            List<Attribution> attributions = result.attributions().stream()
                    .map(a -> a.dateRange() == null ? a.withDateRange(dateRange) : a)
                    .collect(Collectors.toList());
            long elapsed = clock.millis() - t0;

            AnalysisArtifact artifact = new AnalysisArtifact(
                    result.mapLayerOpt().map(m -> m.urlFormat()).orElse(null),
                    region,
                    result.timeSeries(),
                    stats,
                    result.changePercent(),
                    result.stats(),
                    attributions,
                    new AnalysisArtifact.Metadata(plan.analysisType().wireName(), plan.location().label(),
                            plan.timeRange().start().toString(), plan.timeRange().end().toString(), elapsed, false,
                            verdict.warnings(), key));
            cache.set(key, artifact);
            log.info("Analysis finished in {}ms", elapsed);
            return artifact;
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    /**
     * Validation and guardrails only; never calls a remote service.
     */
    public CheckResult check(JsonNode rawPlan) {
        AnalysisPlan plan = validator.validate(rawPlan);
        String key = CacheKeys.analysisKey(plan);
        MDC.put(MDC_KEY, key);
        try {
            return new CheckResult(plan, key, guardrails.evaluate(plan), cache.has(key));
        } finally {
            MDC.remove(MDC_KEY);
        }
    }
}
