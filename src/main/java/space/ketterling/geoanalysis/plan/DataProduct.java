package space.ketterling.geoanalysis.plan;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Optional;

/**
 * High-level phenomenon category. Selects the workflow that executes a plan.
 *
 * <p>
 * Each category carries the date before which its source datasets have thin or
 * no coverage; plans starting earlier get an advisory warning.
 * </p>
 */
public enum DataProduct {
    VEGETATION("vegetation", LocalDate.of(2015, 6, 23)),
    WATER("water", LocalDate.of(1984, 3, 16)),
    URBAN("urban", LocalDate.of(2015, 1, 1)),
    TEMPERATURE("temperature", LocalDate.of(1979, 1, 2)),
    PRECIPITATION("precipitation", LocalDate.of(1981, 1, 1)),
    SOIL_MOISTURE("soil_moisture", LocalDate.of(2015, 1, 1)),
    ELEVATION("elevation", LocalDate.of(2000, 2, 11)),
    LANDCOVER("landcover", LocalDate.of(2020, 1, 1)),
    NIGHTLIGHTS("nightlights", LocalDate.of(2014, 1, 1)),
    POPULATION("population", LocalDate.of(2000, 1, 1)),
    AIR_QUALITY("air_quality", LocalDate.of(2018, 6, 28)),
    OTHER("other", LocalDate.of(2015, 1, 1));

    private final String wireName;
    private final LocalDate availableFrom;

    DataProduct(String wireName, LocalDate availableFrom) {
        this.wireName = wireName;
        this.availableFrom = availableFrom;
    }

    public String wireName() {
        return wireName;
    }

    public LocalDate availableFrom() {
        return availableFrom;
    }

    public static Optional<DataProduct> fromWire(String value) {
        return Arrays.stream(values()).filter(p -> p.wireName.equals(value)).findFirst();
    }
}
