package space.ketterling.geoanalysis.workflow;

/**
 * One value of a series, dated {@code yyyy-MM-dd}.
 */
public record TimeSeriesPoint(String date, double value, String label) {
}
