package space.ketterling.geoanalysis.stats;

/**
 * Descriptive statistics of a time series.
 *
 * @param stdDev population standard deviation
 * @param trend  e.g. {@code increasing (+40.0%)}
 */
public record SeriesStatistics(
        double mean,
        double min,
        String minDate,
        double max,
        String maxDate,
        double stdDev,
        String trend) {
}
