package space.ketterling.geoanalysis.compute;

import space.ketterling.geoanalysis.geo.BoundingBox;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * A filtered view of one remote image collection.
 *
 * @param collectionId   remote catalog id
 * @param band           output band name
 * @param bandExpression expression deriving {@code band}, or {@code null} to
 *                       select it directly
 * @param bounds         spatial filter
 * @param start          first day included
 * @param endExclusive   first day excluded
 * @param maxCloudPercent scene-level cloud filter, or {@code null}
 * @param preprocessing  per-image steps applied in order before the band is
 *                       derived, e.g. {@code mask_s2_clouds}
 */
public record CollectionQuery(
        String collectionId,
        String band,
        String bandExpression,
        BoundingBox bounds,
        LocalDate start,
        LocalDate endExclusive,
        Double maxCloudPercent,
        List<String> preprocessing) {

    public CollectionQuery {
        Objects.requireNonNull(collectionId, "collectionId");
        Objects.requireNonNull(band, "band");
        Objects.requireNonNull(bounds, "bounds");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(endExclusive, "endExclusive");
        if (!start.isBefore(endExclusive))
            throw new IllegalArgumentException("empty window " + start + " .. " + endExclusive);
        preprocessing = preprocessing == null ? List.of() : List.copyOf(preprocessing);
    }

    /**
     * Same collection and filters over another date window.
     */
    public CollectionQuery withWindow(LocalDate newStart, LocalDate newEndExclusive) {
        return new CollectionQuery(collectionId, band, bandExpression, bounds, newStart, newEndExclusive,
                maxCloudPercent, preprocessing);
    }
}
