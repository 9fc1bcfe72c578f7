package space.ketterling.geoanalysis.plan;

import java.util.Arrays;
import java.util.Optional;

/**
 * Derived indices a workflow may compute.
 */
public enum SpectralIndex {
    NDVI("ndvi"),
    NDWI("ndwi"),
    NDBI("ndbi"),
    LST("lst"),
    NONE("none");

    private final String wireName;

    SpectralIndex(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SpectralIndex> fromWire(String value) {
        return Arrays.stream(values()).filter(i -> i.wireName.equals(value)).findFirst();
    }
}
