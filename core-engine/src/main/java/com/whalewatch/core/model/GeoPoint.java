package com.whalewatch.core.model;

import com.whalewatch.core.error.InvalidArgumentException;

import java.io.Serializable;

/**
 * Immutable latitude/longitude pair in decimal degrees.
 *
 * <p>
 * Coordinates are treated on a flat plane; no projection is applied.
 * </p>
 *
 * @since 1.0.0
 */
public final class GeoPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double latitude;
    private final double longitude;

    private GeoPoint(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    /**
     * Create a point.
     *
     * @param latitude  latitude in [-90, 90]
     * @param longitude longitude in [-180, 180]
     * @return the point
     * @throws InvalidArgumentException if either value is not finite or out of
     *                                  range
     */
    public static GeoPoint of(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new InvalidArgumentException("Latitude must be within [-90, 90], got: " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new InvalidArgumentException("Longitude must be within [-180, 180], got: " + longitude);
        }
        return new GeoPoint(latitude, longitude);
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GeoPoint that))
            return false;
        return Double.compare(latitude, that.latitude) == 0
                && Double.compare(longitude, that.longitude) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(latitude) + Double.hashCode(longitude);
    }

    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ")";
    }
}
