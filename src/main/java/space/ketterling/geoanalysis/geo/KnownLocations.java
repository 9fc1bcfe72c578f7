package space.ketterling.geoanalysis.geo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in city boxes used when the geocoder is unavailable.
 */
final class KnownLocations {
    private static final Map<String, BoundingBox> TABLE = new LinkedHashMap<>();

    static {
        // North America
        put("Montreal", -73.9, 45.4, -73.5, 45.7);
        put("New York", -74.3, 40.6, -73.7, 40.9);
        put("Toronto", -79.6, 43.6, -79.1, 43.9);
        put("Vancouver", -123.3, 49.2, -122.9, 49.4);
        put("Los Angeles", -118.7, 33.7, -118.1, 34.3);
        put("Chicago", -88.0, 41.6, -87.5, 42.0);

        // Europe
        put("London", -0.5, 51.3, 0.3, 51.7);
        put("Paris", 2.2, 48.8, 2.5, 49.0);
        put("Berlin", 13.2, 52.4, 13.6, 52.6);
        put("Madrid", -3.8, 40.3, -3.6, 40.5);
        put("Rome", 12.4, 41.8, 12.6, 42.0);
        put("Amsterdam", 4.8, 52.3, 5.0, 52.4);

        // Asia
        put("Tokyo", 139.5, 35.5, 139.9, 35.8);
        put("Osaka", 135.3, 34.5, 135.7, 34.8);
        put("Kyoto", 135.6, 34.9, 135.9, 35.1);
        put("Yokohama", 139.55, 35.35, 139.7, 35.5);
        put("Nagoya", 136.8, 35.1, 137.0, 35.25);
        put("Sapporo", 141.25, 43.0, 141.45, 43.15);
        put("Fukuoka", 130.3, 33.55, 130.5, 33.65);
        put("Beijing", 116.2, 39.8, 116.6, 40.1);
        put("Shanghai", 121.3, 31.1, 121.7, 31.4);
        put("Seoul", 126.8, 37.4, 127.2, 37.7);
        put("Mumbai", 72.7, 18.9, 72.9, 19.3);
        put("Singapore", 103.6, 1.2, 104.0, 1.5);

        // South America
        put("São Paulo", -46.8, -23.7, -46.4, -23.4);
        put("Rio de Janeiro", -43.4, -23.0, -43.1, -22.8);
        put("Buenos Aires", -58.5, -34.7, -58.3, -34.5);

        // Australia
        put("Sydney", 150.9, -34.0, 151.3, -33.7);
        put("Melbourne", 144.8, -38.0, 145.1, -37.7);
    }

    private KnownLocations() {
    }

    private static void put(String name, double w, double s, double e, double n) {
        TABLE.put(name, new BoundingBox(w, s, e, n));
    }

    /**
     * Exact, case-sensitive lookup.
     */
    static Optional<BoundingBox> find(String name) {
        return Optional.ofNullable(TABLE.get(name));
    }

    static List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(TABLE.keySet()));
    }
}
