package com.retailsentinel.core.window;

import com.retailsentinel.core.model.Station;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stations known to the window manager, keyed by id in first-seen order.
 *
 * <p>
 * Unknown station ids are registered lazily with status
 * {@link com.retailsentinel.core.model.StationStatus#UNKNOWN UNKNOWN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class StationRegistry {

    private final Map<String, Station> stations = new LinkedHashMap<>();

    /**
     * @param stationId station id; must not be {@code null}
     * @return the existing station, or a newly registered one
     */
    public Station getOrRegister(String stationId) {
        return stations.computeIfAbsent(stationId, Station::new);
    }

    public Optional<Station> get(String stationId) {
        return Optional.ofNullable(stations.get(stationId));
    }

    /**
     * @return unmodifiable view of all stations in first-seen order
     */
    public Collection<Station> all() {
        return Collections.unmodifiableCollection(stations.values());
    }

    public int size() {
        return stations.size();
    }
}
