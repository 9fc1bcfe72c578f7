package space.ketterling.geoanalysis.geo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.geoanalysis.plan.PlanValidationException;
import space.ketterling.geoanalysis.plan.PlanValidationException.FieldError;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Resolves a plan {@link Location} to a concrete {@link BoundingBox}.
 *
 * <p>
 * Names go to the geocoder once per process; successes and fallback hits are
 * memoised. Boxes are validated and passed through without any remote call.
 * </p>
 */
public final class LocationResolver {
    private static final Logger log = LoggerFactory.getLogger(LocationResolver.class);

    private final Geocoder geocoder;
    private final Map<String, BoundingBox> memo = new ConcurrentHashMap<>();

    /**
     * @param geocoder remote geocoder, or {@code null} to use only the built-in
     *                 table
     */
    public LocationResolver(Geocoder geocoder) {
        this.geocoder = geocoder;
    }

    public BoundingBox resolve(Location location) {
        if (location.isNamed()) {
            return resolveName(location.name().orElseThrow());
        }
        BoundingBox box = location.bbox().orElseThrow();
        List<String> problems = box.problems();
        if (!problems.isEmpty()) {
            throw new PlanValidationException(problems.stream()
                    .map(p -> new FieldError("location", p))
                    .collect(Collectors.toList()));
        }
        return box;
    }

    private BoundingBox resolveName(String rawName) {
        String name = rawName.trim();
        BoundingBox cached = memo.get(name);
        if (cached != null) {
            log.debug("Geocode memo hit for \"{}\"", name);
            return cached;
        }

        Exception failure = null;
        if (geocoder != null) {
            try {
                BoundingBox box = geocoder.geocode(name);
                if (box != null && box.isValid()) {
                    log.info("Geocoded \"{}\" -> {}", name, box.label());
                    memo.put(name, box);
                    return box;
                }
                failure = new IllegalStateException("geocoder returned an unusable box for \"" + name + "\"");
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                failure = ie;
            } catch (Exception e) {
                failure = e;
            }
            log.warn("Geocoding failed for \"{}\": {}", name, failure.getMessage());
        }

        BoundingBox fallback = KnownLocations.find(name).orElse(null);
        if (fallback != null) {
            log.info("Using built-in location for \"{}\"", name);
            memo.put(name, fallback);
            return fallback;
        }
        throw new LocationNotFoundException(name, KnownLocations.names(), failure);
    }

    /**
     * Names served from the built-in table.
     */
    public List<String> knownLocations() {
        return KnownLocations.names();
    }
}
