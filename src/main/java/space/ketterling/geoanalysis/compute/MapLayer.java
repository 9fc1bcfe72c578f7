package space.ketterling.geoanalysis.compute;

import java.util.Objects;

/**
 * Tile URL template ({@code {z}/{x}/{y}}) for a rendered image.
 */
public record MapLayer(String urlFormat) {

    public MapLayer {
        Objects.requireNonNull(urlFormat, "urlFormat");
    }
}
