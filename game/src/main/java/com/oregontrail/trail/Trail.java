package com.oregontrail.trail;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered sequence of locations with a total length ceiling.
 * Insertion order is visit order.
 */
public class Trail {

    @Getter
    private final String name;

    /**
     * Ceiling for the sum of all leg distances.
     */
    @Getter
    private final int trailLength;

    private final List<Location> locations;

    public Trail(String name, List<Location> locations, int trailLength) {
        if (locations == null || locations.isEmpty()) {
            throw new IllegalArgumentException("Trail '" + name + "' must have at least one location");
        }
        if (trailLength <= 0) {
            throw new IllegalArgumentException("Trail length must be positive: " + trailLength);
        }
        this.name = name;
        this.locations = new ArrayList<>(locations);
        this.trailLength = trailLength;
    }

    /**
     * Read-only view of the locations, in visit order.
     *
     * @return the locations
     */
    public List<Location> getLocations() {
        return Collections.unmodifiableList(locations);
    }

    public int size() {
        return locations.size();
    }

    /**
     * Insert a location at a position, shifting later locations back.
     *
     * @param index    position of the new location
     * @param location the location
     */
    void insert(int index, Location location) {
        locations.add(index, location);
    }
}
