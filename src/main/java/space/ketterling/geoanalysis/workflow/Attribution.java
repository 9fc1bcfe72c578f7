package space.ketterling.geoanalysis.workflow;

import java.util.Objects;

/**
 * Credit for a dataset used in a result. {@code license}, {@code citation} and
 * {@code dateRange} may be null.
 */
public record Attribution(String dataset, String source, String license, String citation, String dateRange) {

    public Attribution {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(source, "source");
    }

    public Attribution(String dataset, String source, String license, String citation) {
        this(dataset, source, license, citation, null);
    }

    public Attribution withDateRange(String range) {
        return new Attribution(dataset, source, license, citation, range);
    }
}
