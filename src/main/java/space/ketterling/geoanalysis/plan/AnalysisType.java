package space.ketterling.geoanalysis.plan;

import java.util.Arrays;
import java.util.Optional;

/**
 * Broad analysis types accepted in a plan.
 */
public enum AnalysisType {
    /** Trend or change over time; the default. */
    TIMESERIES("timeseries"),
    /** Explicit before/after comparison. */
    CHANGE("change"),
    /** Deviation from a baseline period. */
    ANOMALY("anomaly"),
    /** Seasonality, usually a year or more. */
    SEASONAL_TREND("seasonal_trend"),
    /** Map for a single date or short window. */
    SINGLE_DATE_MAP("single_date_map"),
    /** Summary statistics for an area of interest. */
    ZONAL_STATISTICS("zonal_statistics");

    private final String wireName;

    AnalysisType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * True for the types answered by a before/after delta instead of a series.
     */
    public boolean isChangeDetection() {
        return this == CHANGE || this == ANOMALY;
    }

    public static Optional<AnalysisType> fromWire(String value) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(value)).findFirst();
    }
}
