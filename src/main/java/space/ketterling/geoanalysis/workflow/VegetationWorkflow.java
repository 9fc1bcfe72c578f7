package space.ketterling.geoanalysis.workflow;

import space.ketterling.geoanalysis.compute.CollectionQuery;
import space.ketterling.geoanalysis.compute.VisParams;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.plan.AnalysisPlan;
import space.ketterling.geoanalysis.plan.DataProduct;
import space.ketterling.geoanalysis.plan.DatasetId;
import space.ketterling.geoanalysis.plan.SpectralIndex;

import java.util.List;
import java.util.Locale;

/**
 * Spectral index (NDVI by default) from Sentinel-2, or Landsat 8/9 when the
 * plan lists one of those first.
 */
public final class VegetationWorkflow extends DatasetWorkflow {
    private static final String S2_COLLECTION = "COPERNICUS/S2_SR_HARMONIZED";
    private static final double DEFAULT_MAX_CLOUD = 20.0;

    public VegetationWorkflow(TimeSeriesExecutor timeSeries, ChangeDetectionExecutor changeDetection) {
        super(timeSeries, changeDetection);
    }

    @Override
    public DataProduct dataProduct() {
        return DataProduct.VEGETATION;
    }

    @Override
    protected String phenomenon(AnalysisPlan plan) {
        return "vegetation (" + index(plan).wireName().toUpperCase(Locale.ROOT) + ")";
    }

    @Override
    protected BucketGranularity granularity() {
        return BucketGranularity.MONTHLY;
    }

    @Override
    protected int defaultScaleMeters() {
        return 100;
    }

    @Override
    protected CollectionQuery collection(AnalysisPlan plan, BoundingBox region) {
        SpectralIndex index = index(plan);
        String band = index.wireName().toUpperCase(Locale.ROOT);
        boolean landsat = isLandsat(plan.primaryDataset());
        String expression = landsat ? landsatExpression(index) : sentinelExpression(index);
        String collection = landsat ? plan.primaryDataset().catalogId() : S2_COLLECTION;
        List<String> steps = landsat ? List.of("mask_landsat_qa_pixel", "scale_landsat_sr") : List.of("mask_s2_clouds");
        // Landsat L2 has no scene cloud percentage property
        Double maxCloud = landsat ? null : plan.parameters().maxCloudPercentOpt().orElse(DEFAULT_MAX_CLOUD);
        return new CollectionQuery(collection, band, expression, region, plan.timeRange().start(),
                plan.timeRange().end().plusDays(1), maxCloud, steps);
    }

    @Override
    protected VisParams seriesVis(AnalysisPlan plan) {
        return VisParams.of(0, 1, "brown", "yellow", "green", "darkgreen");
    }

    @Override
    protected VisParams changeVis(AnalysisPlan plan) {
        return VisParams.of(-0.5, 0.5, "red", "white", "green");
    }

    @Override
    protected ChangeMetric changeMetric() {
        return ChangeMetric.SCALED_FRACTION;
    }

    @Override
    protected List<Attribution> attributions(AnalysisPlan plan) {
        if (isLandsat(plan.primaryDataset())) {
            return List.of(new Attribution("Landsat Collection 2 Level-2", "U.S. Geological Survey",
                    "Public Domain", "Landsat imagery courtesy of the U.S. Geological Survey"));
        }
        return List.of(new Attribution("Sentinel-2 MSI Surface Reflectance", "European Space Agency (ESA) / Copernicus",
                "Copernicus Sentinel Data Terms", "Contains modified Copernicus Sentinel-2 data"));
    }

    private static SpectralIndex index(AnalysisPlan plan) {
        SpectralIndex i = plan.parameters().indexOpt().orElse(SpectralIndex.NDVI);
        return switch (i) {
            case NDVI, NDWI, NDBI -> i;
            default -> SpectralIndex.NDVI;
        };
    }

    private static boolean isLandsat(DatasetId id) {
        return id == DatasetId.LANDSAT8_L2 || id == DatasetId.LANDSAT9_L2;
    }

    private static String sentinelExpression(SpectralIndex index) {
        return switch (index) {
            case NDWI -> "normalizedDifference(B3, B8)";
            case NDBI -> "normalizedDifference(B11, B8)";
            default -> "normalizedDifference(B8, B4)";
        };
    }

    private static String landsatExpression(SpectralIndex index) {
        return switch (index) {
            case NDWI -> "normalizedDifference(SR_B3, SR_B5)";
            case NDBI -> "normalizedDifference(SR_B6, SR_B5)";
            default -> "normalizedDifference(SR_B5, SR_B4)";
        };
    }
}
