package com.whalewatch.core.source;

import com.whalewatch.core.model.SightingEvent;

import java.util.List;
import java.util.Objects;

/**
 * {@link SightingSource} backed by a fixed list, typically the result of a
 * single up-front file load.
 */
public final class InMemorySightingSource implements SightingSource {

    private final List<SightingEvent> events;

    public InMemorySightingSource(List<SightingEvent> events) {
        this.events = List.copyOf(Objects.requireNonNull(events, "events must not be null"));
    }

    /**
     * Load {@code source} once and serve the result from memory afterwards.
     *
     * @param source the source to snapshot
     * @return in-memory copy
     */
    public static InMemorySightingSource snapshotOf(SightingSource source) {
        Objects.requireNonNull(source, "source must not be null");
        return new InMemorySightingSource(source.load());
    }

    @Override
    public List<SightingEvent> load() {
        return events;
    }

    public int size() {
        return events.size();
    }
}
