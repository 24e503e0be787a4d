package com.oregontrail.trail;

/**
 * Visitation state of a location.
 * Locations move through states monotonically:
 * UNVISITED -> ARRIVED -> DEPARTED
 */
public enum LocationStatus {

    /**
     * The vehicle has not reached this location yet.
     * Initial state for all locations.
     */
    UNVISITED,

    /**
     * The vehicle is parked at this location.
     */
    ARRIVED,

    /**
     * The vehicle has left this location.
     * Terminal state.
     */
    DEPARTED;

    /**
     * Check whether moving from this state to {@code next} is allowed.
     *
     * @param next the target state
     * @return true only for the single forward step
     */
    public boolean canTransitionTo(LocationStatus next) {
        switch (this) {
            case UNVISITED:
                return next == ARRIVED;
            case ARRIVED:
                return next == DEPARTED;
            case DEPARTED:
            default:
                return false;
        }
    }

    /**
     * Map marker used by the trail map.
     *
     * @return a one character marker
     */
    public char getMarker() {
        switch (this) {
            case ARRIVED:
                return '*';
            case DEPARTED:
                return 'x';
            case UNVISITED:
            default:
                return ' ';
        }
    }
}
