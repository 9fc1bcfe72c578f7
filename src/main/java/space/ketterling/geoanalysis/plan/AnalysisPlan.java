package space.ketterling.geoanalysis.plan;

import space.ketterling.geoanalysis.geo.Location;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A validated analysis request. Immutable once built.
 *
 * <p>
 * {@code datasetIds} keeps the caller's order; fingerprinting treats it as a
 * set. {@code outputs} keeps first-seen order.
 * </p>
 */
public record AnalysisPlan(
        AnalysisType analysisType,
        DataProduct dataProduct,
        List<DatasetId> datasetIds,
        TimeRange timeRange,
        Location location,
        Set<OutputKind> outputs,
        AnalysisParameters parameters) {

    public AnalysisPlan {
        Objects.requireNonNull(analysisType, "analysisType");
        Objects.requireNonNull(dataProduct, "dataProduct");
        Objects.requireNonNull(timeRange, "timeRange");
        Objects.requireNonNull(location, "location");
        datasetIds = List.copyOf(datasetIds);
        outputs = Collections.unmodifiableSet(new LinkedHashSet<>(outputs));
        parameters = parameters == null ? AnalysisParameters.NONE : parameters;
        if (datasetIds.isEmpty())
            throw new IllegalArgumentException("datasetIds must not be empty");
        if (outputs.isEmpty())
            throw new IllegalArgumentException("outputs must not be empty");
    }

    /**
     * First listed dataset; workflows with one source collection use this one.
     */
    public DatasetId primaryDataset() {
        return datasetIds.get(0);
    }
}
