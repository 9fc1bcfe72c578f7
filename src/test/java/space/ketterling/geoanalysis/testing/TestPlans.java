package space.ketterling.geoanalysis.testing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.geo.Location;
import space.ketterling.geoanalysis.plan.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

/**
 * Plan fixtures shared by the tests.
 */
public final class TestPlans {
    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
    public static final BoundingBox TOKYO_BOX = new BoundingBox(139.5, 35.5, 139.9, 35.8);

    private TestPlans() {
    }

    public static AnalysisPlan plan(AnalysisType type, DataProduct product, String start, String end,
            Location location, DatasetId... datasets) {
        return new AnalysisPlan(type, product, List.of(datasets), TimeRange.of(start, end), location,
                Set.of(OutputKind.TIMESERIES), AnalysisParameters.NONE);
    }

    public static AnalysisPlan temperatureSeries(String start, String end) {
        return plan(AnalysisType.TIMESERIES, DataProduct.TEMPERATURE, start, end, Location.box(TOKYO_BOX),
                DatasetId.ERA5_DAILY);
    }

    /**
     * A valid raw vegetation time series plan for Tokyo, first half of 2024.
     */
    public static ObjectNode rawVegetationPlan(ObjectMapper om) {
        ObjectNode root = om.createObjectNode();
        root.put("analysisType", "timeseries");
        root.put("dataProduct", "vegetation");
        root.putArray("datasetIds").add("COPERNICUS/S2_SR");
        ObjectNode tr = root.putObject("timeRange");
        tr.put("start", "2024-01-01");
        tr.put("end", "2024-06-30");
        root.put("location", "Tokyo");
        root.putArray("outputs").add("map").add("timeseries");
        return root;
    }
}
