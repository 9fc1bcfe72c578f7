package space.ketterling.geoanalysis.compute;

import java.util.List;

/**
 * Stretch and palette for a rendered map layer.
 */
public record VisParams(double min, double max, List<String> palette) {

    public VisParams {
        palette = List.copyOf(palette);
    }

    public static VisParams of(double min, double max, String... palette) {
        return new VisParams(min, max, List.of(palette));
    }
}
