package space.ketterling.geoanalysis.geo;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Axis-aligned box in degrees, ordered {@code [west, south, east, north]}.
 *
 * <p>
 * Construction does not enforce ranges so that callers can report every
 * problem at once through {@link #problems()}.
 * </p>
 */
public record BoundingBox(double west, double south, double east, double north) {

    private static final double KM_PER_DEGREE = 111.0;

    public static BoundingBox of(double[] wsen) {
        if (wsen == null || wsen.length != 4)
            throw new IllegalArgumentException("bbox must have exactly 4 values [west, south, east, north]");
        return new BoundingBox(wsen[0], wsen[1], wsen[2], wsen[3]);
    }

    /**
     * Returns every range or ordering violation; empty when the box is usable.
     */
    public List<String> problems() {
        List<String> out = new ArrayList<>();
        if (!inRange(west, 180) || !inRange(east, 180))
            out.add("Longitude must be between -180 and 180.");
        if (!inRange(south, 90) || !inRange(north, 90))
            out.add("Latitude must be between -90 and 90.");
        if (!(west < east))
            out.add("West longitude must be less than east longitude.");
        if (!(south < north))
            out.add("South latitude must be less than north latitude.");
        return out;
    }

    public boolean isValid() {
        return problems().isEmpty();
    }

    public double widthDegrees() {
        return east - west;
    }

    public double heightDegrees() {
        return north - south;
    }

    /**
     * Pads the box by {@code percent} of its size, split evenly on both sides,
     * clamped to the global coordinate range.
     */
    public BoundingBox expand(double percent) {
        double lonPad = widthDegrees() * percent / 100.0 / 2.0;
        double latPad = heightDegrees() * percent / 100.0 / 2.0;
        return new BoundingBox(
                Math.max(-180.0, west - lonPad),
                Math.max(-90.0, south - latPad),
                Math.min(180.0, east + lonPad),
                Math.min(90.0, north + latPad));
    }

    public BoundingBox expand() {
        return expand(10.0);
    }

    /**
     * Rough area: 1 degree of latitude ~ 111 km, longitude scaled by cos(mid latitude).
     */
    public double approximateAreaKm2() {
        double midLat = Math.toRadians((north + south) / 2.0);
        double heightKm = heightDegrees() * KM_PER_DEGREE;
        double widthKm = widthDegrees() * KM_PER_DEGREE * Math.cos(midLat);
        return heightKm * widthKm;
    }

    public double[] toArray() {
        return new double[] { west, south, east, north };
    }

    /**
     * Human-readable form, e.g. {@code [139.5, 35.5, 139.9, 35.8]}.
     */
    public String label() {
        return "[" + fmt(west) + ", " + fmt(south) + ", " + fmt(east) + ", " + fmt(north) + "]";
    }

    private static boolean inRange(double v, double limit) {
        return !Double.isNaN(v) && v >= -limit && v <= limit;
    }

    private static String fmt(double v) {
        if (v == Math.rint(v) && !Double.isInfinite(v))
            return String.format(Locale.ROOT, "%.1f", v);
        return Double.toString(v);
    }
}
