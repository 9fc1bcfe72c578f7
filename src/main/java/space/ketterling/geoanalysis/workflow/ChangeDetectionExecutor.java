package space.ketterling.geoanalysis.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.geoanalysis.compute.*;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.plan.AnalysisPlan;
import space.ketterling.geoanalysis.plan.Reducer;
import space.ketterling.geoanalysis.plan.TimeRange;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Compares a "before" and an "after" composite split at the midpoint of the
 * plan window.
 */
public final class ChangeDetectionExecutor {
    private static final Logger log = LoggerFactory.getLogger(ChangeDetectionExecutor.class);

    private final ComputeEngine engine;

    public ChangeDetectionExecutor(ComputeEngine engine) {
        this.engine = engine;
    }

    /**
     * Elapsed-time midpoint. Never equal to {@code start}, so the before window
     * is non-empty even for a one-day range.
     */
    static LocalDate midpoint(TimeRange range) {
        return range.start().plusDays(Math.max(1L, range.days() / 2));
    }

    public WorkflowResult execute(DatasetWorkflow wf, AnalysisPlan plan, BoundingBox region) {
        TimeRange range = plan.timeRange();
        LocalDate mid = midpoint(range);
        CollectionQuery full = wf.collection(plan, region);
        Reducer compositeReducer = plan.parameters().reducerOpt().orElse(Reducer.MEDIAN);
        int scale = wf.scaleFor(plan);

        CompositeSpec before = new CompositeSpec(full.withWindow(range.start(), mid), compositeReducer);
        CompositeSpec after = new CompositeSpec(full.withWindow(mid, range.end().plusDays(1)), compositeReducer);
        DifferenceSpec delta = new DifferenceSpec(after, before);

        log.info("Change detection for {}: before {}..{} after {}..{} reducer={}", wf.phenomenon(plan),
                range.start(), mid.minusDays(1), mid, range.end(), compositeReducer.wireName());

        MapLayer map = engine.getMap(delta, wf.changeVis(plan));

        Double meanDelta = engine.reduceRegion(delta, Reducer.MEAN, region, scale);
        if (!TimeSeriesExecutor.isUsable(meanDelta)) {
            throw new NoValidDataException(wf.phenomenon(plan), range, plan.location().label());
        }

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("changeMetric", wf.changeMetric().name().toLowerCase(Locale.ROOT));
        stats.put("midpoint", mid.toString());
        stats.put("meanDelta", meanDelta);

        double change = switch (wf.changeMetric()) {
            case SCALED_FRACTION -> meanDelta * 100.0;
            case ABSOLUTE_DIFFERENCE -> meanDelta;
            case PERCENT_OF_BASELINE -> {
                Double baseline = engine.reduceRegion(before, Reducer.MEAN, region, scale);
                if (!TimeSeriesExecutor.isUsable(baseline) || baseline == 0.0) {
                    throw new NoValidDataException("No usable " + wf.phenomenon(plan)
                            + " baseline for " + range.start() + " to " + mid.minusDays(1) + " at "
                            + plan.location().label() + "; percent change is undefined.");
                }
                stats.put("baseline", baseline);
                yield meanDelta / baseline * 100.0;
            }
        };
        log.info("Change for {}: {} ({})", wf.phenomenon(plan), change, wf.changeMetric());
        return new WorkflowResult(map, null, stats, change, wf.attributions(plan));
    }
}
