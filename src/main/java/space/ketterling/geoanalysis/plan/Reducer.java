package space.ketterling.geoanalysis.plan;

import java.util.Arrays;
import java.util.Optional;

/**
 * Aggregation applied over pixels or observations.
 */
public enum Reducer {
    MEAN("mean"),
    MEDIAN("median"),
    SUM("sum"),
    MIN("min"),
    MAX("max");

    private final String wireName;

    Reducer(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<Reducer> fromWire(String value) {
        return Arrays.stream(values()).filter(r -> r.wireName.equals(value)).findFirst();
    }
}
