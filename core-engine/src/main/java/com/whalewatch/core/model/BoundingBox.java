package com.whalewatch.core.model;

import com.whalewatch.core.error.InvalidArgumentException;

import java.io.Serializable;
import java.util.Objects;

/**
 * Axis-aligned rectangle in latitude/longitude space.
 *
 * <p>
 * Invariant: {@code latMin < latMax} and {@code longMin < longMax}.
 * Containment checks are strict on every edge, so a point lying exactly on
 * the border is outside.
 * </p>
 *
 * @since 1.0.0
 */
public final class BoundingBox implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double latMin;
    private final double latMax;
    private final double longMin;
    private final double longMax;

    /**
     * @throws InvalidArgumentException if the bounds are not finite or the
     *                                  ordering invariant is violated
     */
    public BoundingBox(double latMin, double latMax, double longMin, double longMax) {
        if (!Double.isFinite(latMin) || !Double.isFinite(latMax)
                || !Double.isFinite(longMin) || !Double.isFinite(longMax)) {
            throw new InvalidArgumentException("Bounding box edges must be finite");
        }
        if (latMin >= latMax) {
            throw new InvalidArgumentException(
                    "latMin must be < latMax, got: " + latMin + " >= " + latMax);
        }
        if (longMin >= longMax) {
            throw new InvalidArgumentException(
                    "longMin must be < longMax, got: " + longMin + " >= " + longMax);
        }
        this.latMin = latMin;
        this.latMax = latMax;
        this.longMin = longMin;
        this.longMax = longMax;
    }

    /**
     * Square of the given half-width centred on {@code center}.
     *
     * @param center    centre point; must not be {@code null}
     * @param halfWidth half the side length in degrees; must be &gt; 0
     * @return the square
     */
    public static BoundingBox centeredOn(GeoPoint center, double halfWidth) {
        Objects.requireNonNull(center, "center must not be null");
        if (!(halfWidth > 0)) {
            throw new InvalidArgumentException("halfWidth must be > 0, got: " + halfWidth);
        }
        return new BoundingBox(
                center.getLatitude() - halfWidth,
                center.getLatitude() + halfWidth,
                center.getLongitude() - halfWidth,
                center.getLongitude() + halfWidth);
    }

    /**
     * @param point the point to test; must not be {@code null}
     * @return {@code true} if the point is strictly inside on both axes
     */
    public boolean containsStrictly(GeoPoint point) {
        Objects.requireNonNull(point, "point must not be null");
        return containsStrictly(point.getLatitude(), point.getLongitude());
    }

    public boolean containsStrictly(double latitude, double longitude) {
        return latMin < latitude && latitude < latMax
                && longMin < longitude && longitude < longMax;
    }

    /** @return area in square degrees */
    public double area() {
        return (latMax - latMin) * (longMax - longMin);
    }

    /**
     * Area shared with another box.
     *
     * @param other the other box; must not be {@code null}
     * @return overlap area in square degrees, {@code 0} when disjoint
     */
    public double intersectionArea(BoundingBox other) {
        Objects.requireNonNull(other, "other must not be null");
        double height = Math.min(latMax, other.latMax) - Math.max(latMin, other.latMin);
        double width = Math.min(longMax, other.longMax) - Math.max(longMin, other.longMin);
        if (height <= 0 || width <= 0) {
            return 0.0;
        }
        return height * width;
    }

    public double getLatMin() {
        return latMin;
    }

    public double getLatMax() {
        return latMax;
    }

    public double getLongMin() {
        return longMin;
    }

    public double getLongMax() {
        return longMax;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BoundingBox that))
            return false;
        return Double.compare(latMin, that.latMin) == 0
                && Double.compare(latMax, that.latMax) == 0
                && Double.compare(longMin, that.longMin) == 0
                && Double.compare(longMax, that.longMax) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(latMin, latMax, longMin, longMax);
    }

    @Override
    public String toString() {
        return "BoundingBox{" +
                "lat=[" + latMin + ", " + latMax + "]" +
                ", long=[" + longMin + ", " + longMax + "]" +
                '}';
    }
}
