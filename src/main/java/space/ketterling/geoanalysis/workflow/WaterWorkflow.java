package space.ketterling.geoanalysis.workflow;

import space.ketterling.geoanalysis.compute.CollectionQuery;
import space.ketterling.geoanalysis.compute.CompositeSpec;
import space.ketterling.geoanalysis.compute.ImageSpec;
import space.ketterling.geoanalysis.compute.VisParams;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.plan.AnalysisPlan;
import space.ketterling.geoanalysis.plan.DataProduct;
import space.ketterling.geoanalysis.plan.DatasetId;
import space.ketterling.geoanalysis.plan.Reducer;

import java.util.List;

/**
 * Share of the area covered by permanent or seasonal water, per year, from the
 * JRC yearly water classification history.
 */
public final class WaterWorkflow extends DatasetWorkflow {
    private static final String YEARLY_HISTORY = "JRC/GSW1_4/YearlyHistory";

    public WaterWorkflow(TimeSeriesExecutor timeSeries, ChangeDetectionExecutor changeDetection) {
        super(timeSeries, changeDetection);
    }

    @Override
    public DataProduct dataProduct() {
        return DataProduct.WATER;
    }

    @Override
    protected String phenomenon(AnalysisPlan plan) {
        return "surface water";
    }

    @Override
    protected BucketGranularity granularity() {
        return BucketGranularity.YEARLY;
    }

    @Override
    protected int defaultScaleMeters() {
        return 30;
    }

    @Override
    protected CollectionQuery collection(AnalysisPlan plan, BoundingBox region) {
        // classes 2 (seasonal) and 3 (permanent) count as water
        return new CollectionQuery(YEARLY_HISTORY, "waterClass", "(waterClass == 2) || (waterClass == 3)", region,
                plan.timeRange().start(), plan.timeRange().end().plusDays(1), null, List.of());
    }

    @Override
    protected double normalize(AnalysisPlan plan, double fraction) {
        return fraction * 100.0;
    }

    /**
     * Long-term occurrence layer; the yearly history is too coarse to render.
     */
    @Override
    protected ImageSpec seriesMapImage(AnalysisPlan plan, CollectionQuery fullRange) {
        CollectionQuery occurrence = new CollectionQuery(DatasetId.GLOBAL_SURFACE_WATER.catalogId(), "occurrence",
                null, fullRange.bounds(), fullRange.start(), fullRange.endExclusive(), null, List.of("static_image"));
        return new CompositeSpec(occurrence, Reducer.MEAN);
    }

    @Override
    protected VisParams seriesVis(AnalysisPlan plan) {
        return VisParams.of(0, 100, "white", "lightblue", "blue", "darkblue");
    }

    @Override
    protected VisParams changeVis(AnalysisPlan plan) {
        return VisParams.of(-0.5, 0.5, "brown", "white", "blue");
    }

    @Override
    protected ChangeMetric changeMetric() {
        return ChangeMetric.SCALED_FRACTION;
    }

    @Override
    protected List<Attribution> attributions(AnalysisPlan plan) {
        return List.of(new Attribution("JRC Global Surface Water", "European Commission Joint Research Centre",
                "CC BY 4.0", "Pekel et al. (2016). High-resolution mapping of global surface water and its "
                        + "long-term changes. Nature 540, 418-422."));
    }
}
