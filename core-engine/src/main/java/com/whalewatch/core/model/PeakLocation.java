package com.whalewatch.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Result of density binning: the centre of the busiest grid cell and how many
 * sightings fell into it.
 *
 * @since 1.0.0
 */
public final class PeakLocation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final GeoPoint location;
    private final int count;
    private final long latBin;
    private final long longBin;

    public PeakLocation(GeoPoint location, int count, long latBin, long longBin) {
        this.location = Objects.requireNonNull(location, "location must not be null");
        this.count = count;
        this.latBin = latBin;
        this.longBin = longBin;
    }

    /** @return centre of the winning cell in decimal degrees */
    public GeoPoint getLocation() {
        return location;
    }

    /** @return number of historical sightings in the winning cell */
    public int getCount() {
        return count;
    }

    public long getLatBin() {
        return latBin;
    }

    public long getLongBin() {
        return longBin;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PeakLocation that))
            return false;
        return count == that.count && latBin == that.latBin && longBin == that.longBin
                && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, count, latBin, longBin);
    }

    @Override
    public String toString() {
        return "PeakLocation{location=" + location + ", count=" + count + '}';
    }
}
