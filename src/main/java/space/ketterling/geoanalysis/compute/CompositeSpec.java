package space.ketterling.geoanalysis.compute;

import space.ketterling.geoanalysis.plan.Reducer;

import java.util.Objects;

/**
 * Per-pixel temporal reduction of a collection, e.g. a monthly mean.
 */
public record CompositeSpec(CollectionQuery query, Reducer temporalReducer) implements ImageSpec {

    public CompositeSpec {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(temporalReducer, "temporalReducer");
    }

    @Override
    public String outputBand() {
        return query.band();
    }
}
