package com.libragraph.atlas.formats.api;

/**
 * Axis-aligned bounding box in WGS84 degrees.
 * An undefined box has NaN corners and {@link #isDefined()} false.
 */
public record Bounds(
        double minLon,
        double minLat,
        double maxLon,
        double maxLat
) {
    private static final Bounds UNDEFINED = new Bounds(Double.NaN, Double.NaN, Double.NaN, Double.NaN);

    public static Bounds undefined() {
        return UNDEFINED;
    }

    public boolean isDefined() {
        return !Double.isNaN(minLon) && !Double.isNaN(minLat)
                && !Double.isNaN(maxLon) && !Double.isNaN(maxLat);
    }

    /**
     * Returns a box that also covers the given point. Extending an undefined box
     * yields a box of exactly that point.
     */
    public Bounds extend(double lon, double lat) {
        if (Double.isNaN(lon) || Double.isNaN(lat)) {
            return this;
        }
        if (!isDefined()) {
            return new Bounds(lon, lat, lon, lat);
        }
        return new Bounds(
                Math.min(minLon, lon),
                Math.min(minLat, lat),
                Math.max(maxLon, lon),
                Math.max(maxLat, lat));
    }

    public boolean contains(double lon, double lat) {
        return isDefined()
                && lon >= minLon && lon <= maxLon
                && lat >= minLat && lat <= maxLat;
    }
}
