package space.ketterling.geoanalysis.compute;

import space.ketterling.geoanalysis.geo.BoundingBox;
import space.ketterling.geoanalysis.plan.Reducer;

/**
 * Remote geospatial compute service.
 *
 * <p>
 * Implementations must be safe to call from several worker threads at once.
 * All failures surface as {@link RemoteComputeException}.
 * </p>
 */
public interface ComputeEngine {

    /**
     * Reduces {@code image} over {@code region} to one number.
     *
     * @return the value of the image's output band, or {@code null} when the
     *         engine has no value (no coverage)
     */
    Double reduceRegion(ImageSpec image, Reducer reducer, BoundingBox region, int scaleMeters);

    MapLayer getMap(ImageSpec image, VisParams vis);
}
