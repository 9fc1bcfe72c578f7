package space.ketterling.geoanalysis.workflow;

import space.ketterling.geoanalysis.compute.CollectionQuery;
import space.ketterling.geoanalysis.compute.CompositeSpec;
import space.ketterling.geoanalysis.compute.ImageSpec;
import space.ketterling.geoanalysis.compute.VisParams;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.plan.AnalysisPlan;
import space.ketterling.geoanalysis.plan.Reducer;

import java.util.List;

/**
 * Base for the per-phenomenon workflows.
 *
 * <p>
 * A subclass describes its source collection, units and rendering; the shared
 * executors do the bucketing and before/after comparison. Change and anomaly
 * plans go to change detection, every other analysis type to the time series.
 * </p>
 */
public abstract class DatasetWorkflow implements WorkflowExecutor {
    private final TimeSeriesExecutor timeSeries;
    private final ChangeDetectionExecutor changeDetection;

    protected DatasetWorkflow(TimeSeriesExecutor timeSeries, ChangeDetectionExecutor changeDetection) {
        this.timeSeries = timeSeries;
        this.changeDetection = changeDetection;
    }

    @Override
    public WorkflowResult execute(AnalysisPlan plan, BoundingBox region) {
        return switch (plan.analysisType()) {
            case CHANGE, ANOMALY -> changeDetection.execute(this, plan, region);
            case TIMESERIES, SEASONAL_TREND, SINGLE_DATE_MAP, ZONAL_STATISTICS -> timeSeries.execute(this, plan, region);
        };
    }

    /**
     * Name used in messages, e.g. {@code temperature}.
     */
    protected abstract String phenomenon(AnalysisPlan plan);

    protected abstract BucketGranularity granularity();

    protected abstract int defaultScaleMeters();

    /**
     * Source collection filtered to the whole plan window,
     * {@code [start, end + 1 day)}.
     */
    protected abstract CollectionQuery collection(AnalysisPlan plan, BoundingBox region);

    /**
     * Converts an engine value to display units.
     */
    protected double normalize(AnalysisPlan plan, double raw) {
        return raw;
    }

    protected abstract VisParams seriesVis(AnalysisPlan plan);

    protected abstract VisParams changeVis(AnalysisPlan plan);

    protected abstract ChangeMetric changeMetric();

    protected abstract List<Attribution> attributions(AnalysisPlan plan);

    /**
     * Image rendered next to a time series; the mean composite by default.
     */
    protected ImageSpec seriesMapImage(AnalysisPlan plan, CollectionQuery fullRange) {
        return new CompositeSpec(fullRange, Reducer.MEAN);
    }

    int scaleFor(AnalysisPlan plan) {
        return plan.parameters().scaleMetersOpt().orElse(defaultScaleMeters());
    }
}
