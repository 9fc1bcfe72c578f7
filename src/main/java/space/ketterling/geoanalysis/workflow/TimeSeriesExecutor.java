package space.ketterling.geoanalysis.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.geoanalysis.compute.*;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.plan.AnalysisPlan;
import space.ketterling.geoanalysis.plan.Reducer;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;

/**
 * Computes one value per calendar bucket and assembles a chronological series.
 *
 * <p>
 * Buckets are reduced concurrently on a shared bounded pool. A bucket that
 * fails or exceeds its timeout is logged and left out; the others are kept.
 * Values that are null, NaN or infinite mean "no coverage" and are skipped.
 * </p>
 */
public final class TimeSeriesExecutor {
    private static final Logger log = LoggerFactory.getLogger(TimeSeriesExecutor.class);

    private final ComputeEngine engine;
    private final ExecutorService pool;
    private final Duration bucketTimeout;
    private final Duration requestDeadline;

    public TimeSeriesExecutor(ComputeEngine engine, ExecutorService pool, Duration bucketTimeout,
            Duration requestDeadline) {
        this.engine = engine;
        this.pool = pool;
        this.bucketTimeout = bucketTimeout;
        this.requestDeadline = requestDeadline;
    }

    public WorkflowResult execute(DatasetWorkflow wf, AnalysisPlan plan, BoundingBox region) {
        List<TimeBucket> buckets = CalendarBuckets.partition(plan.timeRange(), wf.granularity());
        CollectionQuery full = wf.collection(plan, region);
        int scale = wf.scaleFor(plan);
        Reducer spatial = plan.parameters().reducerOpt().orElse(Reducer.MEAN);

        log.info("Processing {} {} buckets for {} ({}) scale={}m", buckets.size(),
                wf.granularity().name().toLowerCase(Locale.ROOT), wf.phenomenon(plan), plan.timeRange(), scale);

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Future<Double>> futures = new ArrayList<>(buckets.size());
        for (TimeBucket b : buckets) {
            CompositeSpec composite = new CompositeSpec(full.withWindow(b.start(), b.endExclusive()), Reducer.MEAN);
            futures.add(pool.submit(withMdc(mdc, () -> engine.reduceRegion(composite, spatial, region, scale))));
        }

        long deadline = System.nanoTime() + requestDeadline.toNanos();
        List<TimeSeriesPoint> points = new ArrayList<>();
        int failed = 0;
        int empty = 0;
        for (int i = 0; i < buckets.size(); i++) {
            TimeBucket b = buckets.get(i);
            Future<Double> f = futures.get(i);
            long remaining = Math.max(0L, deadline - System.nanoTime());
            long waitNanos = Math.min(bucketTimeout.toNanos(), remaining);
            Double raw;
            try {
                raw = f.get(waitNanos, TimeUnit.NANOSECONDS);
            } catch (TimeoutException te) {
                f.cancel(true);
                failed++;
                log.warn("Bucket {} timed out after {}ms", b.label(), TimeUnit.NANOSECONDS.toMillis(waitNanos));
                continue;
            } catch (ExecutionException ee) {
                failed++;
                Throwable cause = ee.getCause() == null ? ee : ee.getCause();
                log.warn("Bucket {} failed: {}", b.label(), cause.getMessage());
                continue;
            } catch (CancellationException ce) {
                failed++;
                log.warn("Bucket {} was cancelled", b.label());
                continue;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                futures.forEach(x -> x.cancel(true));
                throw new RemoteComputeException("Interrupted while waiting for bucket results", ie);
            }

            if (!isUsable(raw)) {
                empty++;
                log.debug("Bucket {} has no valid data", b.label());
                continue;
            }
            double value = wf.normalize(plan, raw);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                empty++;
                continue;
            }
            points.add(new TimeSeriesPoint(b.representativeDate().toString(), value, b.label()));
        }

        log.info("Buckets for {}: requested={} included={} failed={} empty={}", wf.phenomenon(plan),
                buckets.size(), points.size(), failed, empty);
        if (points.isEmpty()) {
            throw new NoValidDataException(wf.phenomenon(plan), plan.timeRange(), plan.location().label());
        }

        MapLayer map = engine.getMap(wf.seriesMapImage(plan, full), wf.seriesVis(plan));

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("bucketsRequested", buckets.size());
        stats.put("bucketsFailed", failed);
        stats.put("bucketsEmpty", empty);
        stats.put("bucketsIncluded", points.size());
        stats.put("granularity", wf.granularity().name().toLowerCase(Locale.ROOT));
        stats.put("scaleMeters", scale);
        return new WorkflowResult(map, points, stats, null, wf.attributions(plan));
    }

    static boolean isUsable(Double v) {
        return v != null && !v.isNaN() && !v.isInfinite();
    }

    private static <T> Callable<T> withMdc(Map<String, String> ctx, Callable<T> task) {
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (ctx == null)
                MDC.clear();
            else
                MDC.setContextMap(ctx);
            try {
                return task.call();
            } finally {
                if (previous == null)
                    MDC.clear();
                else
                    MDC.setContextMap(previous);
            }
        };
    }
}
