package space.ketterling.geoanalysis.plan;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Inclusive calendar window of an analysis, at day granularity.
 */
public record TimeRange(LocalDate start, LocalDate end) {

    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public static TimeRange of(String start, String end) {
        return new TimeRange(LocalDate.parse(start), LocalDate.parse(end));
    }

    /**
     * Calendar days from start to end.
     */
    public long days() {
        return ChronoUnit.DAYS.between(start, end);
    }

    @Override
    public String toString() {
        return start + " to " + end;
    }
}
