package space.ketterling.geoanalysis.geo;

import space.ketterling.geoanalysis.AnalysisException;

import java.util.List;

/**
 * A place name could not be geocoded and is not in the fallback table.
 */
public final class LocationNotFoundException extends AnalysisException {
    private final String locationName;
    private final List<String> knownLocations;

    public LocationNotFoundException(String locationName, List<String> knownLocations, Throwable cause) {
        super("location_not_found", "Unable to find location \"" + locationName
                + "\". Try a different location or provide coordinates as [west, south, east, north]. Known locations: "
                + String.join(", ", knownLocations), cause);
        this.locationName = locationName;
        this.knownLocations = List.copyOf(knownLocations);
    }

    public String locationName() {
        return locationName;
    }

    public List<String> knownLocations() {
        return knownLocations;
    }
}
