package space.ketterling.geoanalysis.geo;

import java.util.Objects;
import java.util.Optional;

/**
 * Either a named place or an explicit bounding box. Exactly one is present.
 */
public final class Location {
    private final String name;
    private final BoundingBox bbox;

    private Location(String name, BoundingBox bbox) {
        this.name = name;
        this.bbox = bbox;
    }

    public static Location named(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank())
            throw new IllegalArgumentException("Location name cannot be empty");
        return new Location(name, null);
    }

    public static Location box(BoundingBox bbox) {
        return new Location(null, Objects.requireNonNull(bbox, "bbox"));
    }

    public boolean isNamed() {
        return name != null;
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public Optional<BoundingBox> bbox() {
        return Optional.ofNullable(bbox);
    }

    /**
     * Name as given, or the bbox label.
     */
    public String label() {
        return isNamed() ? name : bbox.label();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Location))
            return false;
        Location other = (Location) o;
        return Objects.equals(name, other.name) && Objects.equals(bbox, other.bbox);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, bbox);
    }

    @Override
    public String toString() {
        return label();
    }
}
