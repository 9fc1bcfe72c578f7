package space.ketterling.geoanalysis.workflow;

import space.ketterling.geoanalysis.compute.CollectionQuery;
import space.ketterling.geoanalysis.compute.VisParams;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.plan.AnalysisPlan;
import space.ketterling.geoanalysis.plan.DataProduct;
import space.ketterling.geoanalysis.plan.DatasetId;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Trace gas columns from Sentinel-5P TROPOMI. The first dataset id picks the
 * gas.
 */
public final class AirQualityWorkflow extends DatasetWorkflow {
    private static final double MOL_TO_UMOL = 1_000_000.0;

    enum Pollutant {
        NO2(DatasetId.S5P_NO2, "tropospheric_NO2_column_number_density", 0, 0.0002),
        CO(DatasetId.S5P_CO, "CO_column_number_density", 0, 0.05),
        O3(DatasetId.S5P_O3, "O3_column_number_density", 0.12, 0.15),
        SO2(DatasetId.S5P_SO2, "SO2_column_number_density", 0, 0.0005),
        // mixing ratio in ppb, not a column density
        CH4(DatasetId.S5P_CH4, "CH4_column_volume_mixing_ratio_dry_air", 1750, 1900),
        HCHO(DatasetId.S5P_HCHO, "tropospheric_HCHO_column_number_density", 0, 0.0003);

        final DatasetId dataset;
        final String band;
        final double visMin;
        final double visMax;

        Pollutant(DatasetId dataset, String band, double visMin, double visMax) {
            this.dataset = dataset;
            this.band = band;
            this.visMin = visMin;
            this.visMax = visMax;
        }

        static Pollutant of(DatasetId id) {
            for (Pollutant p : values()) {
                if (p.dataset == id)
                    return p;
            }
            throw new UnsupportedWorkflowException("Unsupported air quality dataset: " + id.catalogId()
                    + ". Must be a Sentinel-5P dataset.", supportedDatasets());
        }

        static List<String> supportedDatasets() {
            return Arrays.stream(values()).map(p -> p.dataset.catalogId()).collect(Collectors.toList());
        }
    }

    public AirQualityWorkflow(TimeSeriesExecutor timeSeries, ChangeDetectionExecutor changeDetection) {
        super(timeSeries, changeDetection);
    }

    @Override
    public DataProduct dataProduct() {
        return DataProduct.AIR_QUALITY;
    }

    @Override
    protected String phenomenon(AnalysisPlan plan) {
        return "air quality (" + pollutant(plan).name() + ")";
    }

    @Override
    protected BucketGranularity granularity() {
        return BucketGranularity.MONTHLY;
    }

    @Override
    protected int defaultScaleMeters() {
        return 1_000;
    }

    @Override
    protected CollectionQuery collection(AnalysisPlan plan, BoundingBox region) {
        Pollutant p = pollutant(plan);
        String band = plan.parameters().bandOpt().orElse(p.band);
        return new CollectionQuery(p.dataset.catalogId(), band, null, region, plan.timeRange().start(),
                plan.timeRange().end().plusDays(1), null, List.of());
    }

    /**
     * mol/m² to µmol/m²; CH4 is already in ppb.
     */
    @Override
    protected double normalize(AnalysisPlan plan, double raw) {
        return pollutant(plan) == Pollutant.CH4 ? raw : raw * MOL_TO_UMOL;
    }

    @Override
    protected VisParams seriesVis(AnalysisPlan plan) {
        Pollutant p = pollutant(plan);
        return VisParams.of(p.visMin, p.visMax, "blue", "green", "yellow", "red");
    }

    @Override
    protected VisParams changeVis(AnalysisPlan plan) {
        return VisParams.of(-0.00005, 0.00005, "blue", "white", "red");
    }

    @Override
    protected ChangeMetric changeMetric() {
        return ChangeMetric.PERCENT_OF_BASELINE;
    }

    @Override
    protected List<Attribution> attributions(AnalysisPlan plan) {
        return List.of(new Attribution("Sentinel-5P TROPOMI", "European Space Agency (ESA) / Copernicus",
                "CC BY 4.0", "Contains modified Copernicus Sentinel-5P TROPOMI data"));
    }

    private static Pollutant pollutant(AnalysisPlan plan) {
        return Pollutant.of(plan.primaryDataset());
    }
}
