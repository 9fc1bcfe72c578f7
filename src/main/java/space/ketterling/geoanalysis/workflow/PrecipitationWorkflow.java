package space.ketterling.geoanalysis.workflow;

import space.ketterling.geoanalysis.compute.CollectionQuery;
import space.ketterling.geoanalysis.compute.VisParams;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.plan.AnalysisPlan;
import space.ketterling.geoanalysis.plan.DataProduct;
import space.ketterling.geoanalysis.plan.DatasetId;

import java.util.List;

/**
 * Mean daily rainfall (mm/day) from CHIRPS.
 */
public final class PrecipitationWorkflow extends DatasetWorkflow {

    public PrecipitationWorkflow(TimeSeriesExecutor timeSeries, ChangeDetectionExecutor changeDetection) {
        super(timeSeries, changeDetection);
    }

    @Override
    public DataProduct dataProduct() {
        return DataProduct.PRECIPITATION;
    }

    @Override
    protected String phenomenon(AnalysisPlan plan) {
        return "precipitation";
    }

    @Override
    protected BucketGranularity granularity() {
        return BucketGranularity.MONTHLY;
    }

    @Override
    protected int defaultScaleMeters() {
        return 5_000;
    }

    @Override
    protected CollectionQuery collection(AnalysisPlan plan, BoundingBox region) {
        String band = plan.parameters().bandOpt().orElse("precipitation");
        return new CollectionQuery(DatasetId.CHIRPS_DAILY.catalogId(), band, null, region,
                plan.timeRange().start(), plan.timeRange().end().plusDays(1), null, List.of());
    }

    @Override
    protected VisParams seriesVis(AnalysisPlan plan) {
        return VisParams.of(0, 20, "white", "lightblue", "blue", "darkblue", "purple");
    }

    @Override
    protected VisParams changeVis(AnalysisPlan plan) {
        return VisParams.of(-10, 10, "brown", "white", "blue");
    }

    @Override
    protected ChangeMetric changeMetric() {
        return ChangeMetric.ABSOLUTE_DIFFERENCE;
    }

    @Override
    protected List<Attribution> attributions(AnalysisPlan plan) {
        return List.of(new Attribution("CHIRPS Daily", "Climate Hazards Group, UC Santa Barbara", "CC BY 4.0",
                "Funk et al. (2015). The climate hazards infrared precipitation with stations, a new environmental "
                        + "record for monitoring extremes. Scientific Data 2, 150066."));
    }
}
