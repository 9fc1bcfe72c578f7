package space.ketterling.geoanalysis.workflow;

import java.time.LocalDate;

/**
 * One calendar sub-window of an analysis.
 *
 * @param start              first day
 * @param end                last day, inclusive
 * @param label              {@code yyyy-MM} or {@code yyyy}
 * @param representativeDate date the bucket's value is plotted at
 */
public record TimeBucket(LocalDate start, LocalDate end, String label, LocalDate representativeDate) {

    public LocalDate endExclusive() {
        return end.plusDays(1);
    }
}
