package space.ketterling.geoanalysis.workflow;

import space.ketterling.geoanalysis.compute.MapLayer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What a workflow produced. At least one attribution is always present.
 */
public record WorkflowResult(
        MapLayer mapLayer,
        List<TimeSeriesPoint> timeSeries,
        Map<String, Object> stats,
        Double changePercent,
        List<Attribution> attributions) {

    public WorkflowResult {
        timeSeries = timeSeries == null ? null : List.copyOf(timeSeries);
        stats = stats == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stats));
        if (attributions == null || attributions.isEmpty())
            throw new IllegalArgumentException("a workflow result needs at least one attribution");
        attributions = List.copyOf(attributions);
    }

    public Optional<MapLayer> mapLayerOpt() {
        return Optional.ofNullable(mapLayer);
    }

    public Optional<List<TimeSeriesPoint>> timeSeriesOpt() {
        return Optional.ofNullable(timeSeries);
    }

    public Optional<Double> changePercentOpt() {
        return Optional.ofNullable(changePercent);
    }
}
