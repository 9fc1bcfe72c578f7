package space.ketterling.geoanalysis.workflow;

import space.ketterling.geoanalysis.compute.CollectionQuery;
import space.ketterling.geoanalysis.compute.VisParams;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.plan.AnalysisPlan;
import space.ketterling.geoanalysis.plan.DataProduct;
import space.ketterling.geoanalysis.plan.DatasetId;

import java.util.List;

/**
 * Near-surface air temperature from ERA5 daily aggregates, reported in
 * degrees Celsius.
 */
public final class TemperatureWorkflow extends DatasetWorkflow {
    static final String DEFAULT_BAND = "mean_2m_air_temperature";
    private static final double KELVIN_OFFSET = 273.15;

    public TemperatureWorkflow(TimeSeriesExecutor timeSeries, ChangeDetectionExecutor changeDetection) {
        super(timeSeries, changeDetection);
    }

    @Override
    public DataProduct dataProduct() {
        return DataProduct.TEMPERATURE;
    }

    @Override
    protected String phenomenon(AnalysisPlan plan) {
        return "temperature";
    }

    @Override
    protected BucketGranularity granularity() {
        return BucketGranularity.MONTHLY;
    }

    @Override
    protected int defaultScaleMeters() {
        // ERA5 is ~11 km
        return 10_000;
    }

    @Override
    protected CollectionQuery collection(AnalysisPlan plan, BoundingBox region) {
        String band = plan.parameters().bandOpt().orElse(DEFAULT_BAND);
        return new CollectionQuery(DatasetId.ERA5_DAILY.catalogId(), band, null, region,
                plan.timeRange().start(), plan.timeRange().end().plusDays(1), null, List.of());
    }

    @Override
    protected double normalize(AnalysisPlan plan, double kelvin) {
        return kelvin - KELVIN_OFFSET;
    }

    @Override
    protected VisParams seriesVis(AnalysisPlan plan) {
        // -20..40 C, expressed in the image's Kelvin
        return VisParams.of(-20 + KELVIN_OFFSET, 40 + KELVIN_OFFSET, "blue", "cyan", "yellow", "orange", "red");
    }

    @Override
    protected VisParams changeVis(AnalysisPlan plan) {
        return VisParams.of(-10, 10, "blue", "white", "red");
    }

    @Override
    protected ChangeMetric changeMetric() {
        // a Kelvin difference equals a Celsius difference
        return ChangeMetric.ABSOLUTE_DIFFERENCE;
    }

    @Override
    protected List<Attribution> attributions(AnalysisPlan plan) {
        return List.of(new Attribution("ERA5 Daily Aggregates", "ECMWF / Copernicus Climate Change Service",
                "Copernicus License",
                "Hersbach et al. (2020). ERA5 hourly data on single levels from 1940 to present"));
    }
}
