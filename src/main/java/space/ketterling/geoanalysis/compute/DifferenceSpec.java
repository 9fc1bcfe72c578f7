package space.ketterling.geoanalysis.compute;

import java.util.Objects;

/**
 * Per-pixel {@code after - before}.
 */
public record DifferenceSpec(ImageSpec after, ImageSpec before) implements ImageSpec {

    public DifferenceSpec {
        Objects.requireNonNull(after, "after");
        Objects.requireNonNull(before, "before");
    }

    @Override
    public String outputBand() {
        return after.outputBand();
    }
}
