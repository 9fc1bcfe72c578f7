package space.ketterling.geoanalysis.stats;

import space.ketterling.geoanalysis.workflow.TimeSeriesPoint;

import java.util.List;
import java.util.Locale;

/**
 * Summarises a chronological series.
 */
public final class StatisticsAggregator {
    /** Percent change beyond which a series counts as trending. */
    static final double TREND_THRESHOLD_PCT = 5.0;

    private StatisticsAggregator() {
    }

    /**
     * @throws IllegalArgumentException for an empty series
     */
    public static SeriesStatistics summarize(List<TimeSeriesPoint> series) {
        if (series == null || series.isEmpty())
            throw new IllegalArgumentException("cannot summarise an empty series");

        double sum = 0.0;
        TimeSeriesPoint min = series.get(0);
        TimeSeriesPoint max = series.get(0);
        for (TimeSeriesPoint p : series) {
            sum += p.value();
            // strict comparisons keep the first occurrence
            if (p.value() < min.value())
                min = p;
            if (p.value() > max.value())
                max = p;
        }
        double mean = sum / series.size();

        double sq = 0.0;
        for (TimeSeriesPoint p : series) {
            double d = p.value() - mean;
            sq += d * d;
        }
        double stdDev = Math.sqrt(sq / series.size());

        String trend = trend(series.get(0).value(), series.get(series.size() - 1).value());
        return new SeriesStatistics(mean, min.value(), min.date(), max.value(), max.date(), stdDev, trend);
    }

    static String trend(double first, double last) {
        if (first == 0.0) {
            // percentage undefined, report direction only
            if (last > 0.0)
                return "increasing";
            if (last < 0.0)
                return "decreasing";
            return "stable";
        }
        double pct = (last - first) / Math.abs(first) * 100.0;
        String direction;
        if (pct > TREND_THRESHOLD_PCT)
            direction = "increasing";
        else if (pct < -TREND_THRESHOLD_PCT)
            direction = "decreasing";
        else
            direction = "stable";
        return String.format(Locale.ROOT, "%s (%+.1f%%)", direction, pct);
    }
}
