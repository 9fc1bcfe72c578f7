package space.ketterling.geoanalysis.workflow;

import space.ketterling.geoanalysis.plan.TimeRange;

import java.time.LocalDate;
import java.time.Year;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits an inclusive date range into contiguous calendar buckets.
 */
public final class CalendarBuckets {

    private CalendarBuckets() {
    }

    /**
     * Buckets cover the range exactly: the first starts on {@code range.start()},
     * the last ends on {@code range.end()}, and partial months or years at
     * either edge are clipped rather than extended.
     */
    public static List<TimeBucket> partition(TimeRange range, BucketGranularity granularity) {
        LocalDate end = range.end();
        List<TimeBucket> out = new ArrayList<>();
        LocalDate cursor = range.start();
        while (!cursor.isAfter(end)) {
            LocalDate periodEnd;
            String label;
            LocalDate representative;
            switch (granularity) {
                case MONTHLY -> {
                    YearMonth ym = YearMonth.from(cursor);
                    periodEnd = ym.atEndOfMonth();
                    label = ym.toString();
                    representative = ym.atDay(15);
                }
                case YEARLY -> {
                    Year y = Year.from(cursor);
                    periodEnd = y.atMonth(12).atEndOfMonth();
                    label = y.toString();
                    representative = y.atMonth(7).atDay(1);
                }
                default -> throw new IllegalArgumentException("Unknown granularity " + granularity);
            }
            if (periodEnd.isAfter(end))
                periodEnd = end;
            out.add(new TimeBucket(cursor, periodEnd, label, representative));
            cursor = periodEnd.plusDays(1);
        }
        return out;
    }
}
