package com.whalewatch.core.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A single recorded observation: when, which pod label, and where.
 *
 * <p>
 * Instances are immutable once loaded and are consumed read-only by every
 * estimator. The category label is kept verbatim; a compound label such as
 * {@code "JK"} is resolved against the known categories by the classifier.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code timestamp}, {@code category} and
 * {@code location} are <strong>required</strong>; omitting any of them throws
 * a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class SightingEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LocalDateTime timestamp;
    private final String category;
    private final GeoPoint location;

    private SightingEvent(Builder builder) {
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.category = Objects.requireNonNull(builder.category, "category must not be null");
        this.location = Objects.requireNonNull(builder.location, "location must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link SightingEvent} instances.
     */
    public static class Builder {
        private LocalDateTime timestamp;
        private String category;
        private GeoPoint location;

        public Builder timestamp(LocalDateTime timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder location(GeoPoint location) {
            this.location = location;
            return this;
        }

        public Builder location(double latitude, double longitude) {
            this.location = GeoPoint.of(latitude, longitude);
            return this;
        }

        public SightingEvent build() {
            return new SightingEvent(this);
        }
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public String getCategory() {
        return category;
    }

    public GeoPoint getLocation() {
        return location;
    }

    public double getLatitude() {
        return location.getLatitude();
    }

    public double getLongitude() {
        return location.getLongitude();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SightingEvent that))
            return false;
        return timestamp.equals(that.timestamp)
                && category.equals(that.category)
                && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, category, location);
    }

    @Override
    public String toString() {
        return "SightingEvent{" +
                "timestamp=" + timestamp +
                ", category='" + category + '\'' +
                ", location=" + location +
                '}';
    }
}
