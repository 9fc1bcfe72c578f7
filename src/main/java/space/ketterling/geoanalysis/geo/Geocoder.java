package space.ketterling.geoanalysis.geo;

/**
 * Turns a place name into a bounding box.
 */
public interface Geocoder {

    /**
     * Looks up one place name.
     *
     * @return the bounding box of the best match
     * @throws Exception when the service fails or has no match
     */
    BoundingBox geocode(String placeName) throws Exception;
}
