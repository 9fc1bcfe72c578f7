package space.ketterling.geoanalysis.plan;

import java.util.Optional;

/**
 * Optional tuning knobs. A {@code null} field means "use the workflow default".
 */
public record AnalysisParameters(
        SpectralIndex index,
        String band,
        Reducer reducer,
        Integer scaleMeters,
        Double maxCloudPercent) {

    public static final AnalysisParameters NONE = new AnalysisParameters(null, null, null, null, null);

    public Optional<SpectralIndex> indexOpt() {
        return Optional.ofNullable(index);
    }

    public Optional<String> bandOpt() {
        return Optional.ofNullable(band);
    }

    public Optional<Reducer> reducerOpt() {
        return Optional.ofNullable(reducer);
    }

    public Optional<Integer> scaleMetersOpt() {
        return Optional.ofNullable(scaleMeters);
    }

    public Optional<Double> maxCloudPercentOpt() {
        return Optional.ofNullable(maxCloudPercent);
    }
}
