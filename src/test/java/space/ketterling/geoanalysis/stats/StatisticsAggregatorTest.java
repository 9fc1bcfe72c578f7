package space.ketterling.geoanalysis.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.geoanalysis.workflow.TimeSeriesPoint;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("StatisticsAggregator Tests")
class StatisticsAggregatorTest {

    private static TimeSeriesPoint p(String date, double v) {
        return new TimeSeriesPoint(date, v, null);
    }

    @Test
    @DisplayName("Summary of a rising series")
    void testSummarize() {
        SeriesStatistics s = StatisticsAggregator.summarize(List.of(
                p("2024-01-15", 0.5), p("2024-02-15", 0.6), p("2024-03-15", 0.4), p("2024-04-15", 0.7)));

        assertEquals(0.55, s.mean(), 1e-9);
        assertEquals(0.4, s.min(), 1e-9);
        assertEquals("2024-03-15", s.minDate());
        assertEquals(0.7, s.max(), 1e-9);
        assertEquals("2024-04-15", s.maxDate());
        assertEquals(Math.sqrt(0.0125), s.stdDev(), 1e-9);
        assertEquals("increasing (+40.0%)", s.trend());
    }

    @Test
    @DisplayName("Ties keep the first date")
    void testTies() {
        SeriesStatistics s = StatisticsAggregator.summarize(List.of(
                p("a", 1.0), p("b", 3.0), p("c", 1.0), p("d", 3.0)));
        assertEquals("a", s.minDate());
        assertEquals("b", s.maxDate());
    }

    @Test
    @DisplayName("Single point is stable with zero spread")
    void testSinglePoint() {
        SeriesStatistics s = StatisticsAggregator.summarize(List.of(p("2024-01-15", 12.0)));
        assertEquals(0.0, s.stdDev());
        assertEquals("stable (+0.0%)", s.trend());
    }

    @Test
    @DisplayName("Trend thresholds and negative baselines")
    void testTrend() {
        assertEquals("stable (+5.0%)", StatisticsAggregator.trend(100, 105));
        assertEquals("decreasing (-10.0%)", StatisticsAggregator.trend(100, 90));
        // relative to the magnitude of the first value
        assertEquals("increasing (+50.0%)", StatisticsAggregator.trend(-10, -5));
    }

    @Test
    @DisplayName("Zero first value reports direction only")
    void testZeroFirst() {
        assertEquals("increasing", StatisticsAggregator.trend(0, 2));
        assertEquals("decreasing", StatisticsAggregator.trend(0, -2));
        assertEquals("stable", StatisticsAggregator.trend(0, 0));
    }

    @Test
    @DisplayName("Empty series is rejected")
    void testEmpty() {
        assertThrows(IllegalArgumentException.class, () -> StatisticsAggregator.summarize(List.of()));
    }
}
