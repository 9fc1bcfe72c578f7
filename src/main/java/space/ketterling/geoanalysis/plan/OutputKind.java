package space.ketterling.geoanalysis.plan;

import java.util.Arrays;
import java.util.Optional;

/**
 * Artifact kinds a caller can request.
 */
public enum OutputKind {
    MAP("map"),
    TIMESERIES("timeseries"),
    STATISTICS("statistics"),
    SUMMARY("summary");

    private final String wireName;

    OutputKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<OutputKind> fromWire(String value) {
        return Arrays.stream(values()).filter(o -> o.wireName.equals(value)).findFirst();
    }
}
