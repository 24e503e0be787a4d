package com.oregontrail.trail;

import com.oregontrail.core.SimulationModule;
import com.oregontrail.mode.ModeStack;
import com.oregontrail.mode.ModeType;
import com.oregontrail.time.TimeModule;
import com.oregontrail.vehicle.Vehicle;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Tracks the vehicle position along the trail.
 *
 * <p>The last valid location index is {@code size - 1}. An index equal to the
 * number of locations means the trail is complete; every guard in this class
 * uses that one rule.
 *
 * <p>Per location the progression is:
 * <ol>
 *   <li>arrival: location flagged ARRIVED, vehicle parked, location mode pushed,
 *       leg distance to the following location generated</li>
 *   <li>departure: location flagged DEPARTED, leg distance loaded, vehicle rolling</li>
 *   <li>each fixed tick subtracts the vehicle mileage until the next arrival</li>
 * </ol>
 */
@Slf4j
public class TrailModule implements SimulationModule {

    // ========================================================================
    // Dependencies
    // ========================================================================

    private final Vehicle vehicle;

    private final TimeModule time;

    private final ModeStack modes;

    private final DistanceGenerator distanceGenerator;

    // ========================================================================
    // State
    // ========================================================================

    @Nullable
    private Trail trail;

    @Getter
    private int locationIndex;

    /**
     * Miles left before the next arrival. 0 while at a location.
     */
    @Getter
    private int distanceToNextLocation;

    /**
     * Length of the leg ahead of the current location, generated on arrival.
     */
    @Getter
    private int legDistance;

    /**
     * Sum of every leg generated so far, never above the trail length unless the budget ran out.
     */
    @Getter
    private int distanceAllotted;

    public TrailModule(Trail trail, Vehicle vehicle, TimeModule time, ModeStack modes,
                       DistanceGenerator distanceGenerator) {
        this.trail = trail;
        this.vehicle = vehicle;
        this.time = time;
        this.modes = modes;
        this.distanceGenerator = distanceGenerator;
    }

    // ========================================================================
    // Tick
    // ========================================================================

    @Override
    public void onTick(boolean systemTick) {
        if (isTrailComplete() || reachedNextPoint()) {
            return;
        }

        int remaining = distanceToNextLocation - vehicle.getMileage();
        if (remaining > 0) {
            distanceToNextLocation = remaining;
            log.debug("{} miles to {}", remaining,
                    nextLocation().map(Location::getName).orElse("end of trail"));
            return;
        }

        distanceToNextLocation = 0;
        arriveAtNextLocation();
    }

    /**
     * Move to the following location, or finish the game when there is none.
     * Does nothing once the trail is complete.
     */
    public void arriveAtNextLocation() {
        if (isTrailComplete()) {
            log.debug("Arrival ignored, trail already complete");
            return;
        }

        // The opening tick arrives at the first location without moving past it.
        if (time.getTotalTurns() > 0) {
            locationIndex++;
        }

        if (locationIndex >= trail.size()) {
            vehicle.park();
            log.info("Reached the end of the trail after {} miles", vehicle.getOdometer());
            modes.addMode(ModeType.END_GAME);
            return;
        }

        Location current = trail.getLocations().get(locationIndex);
        legDistance = generateLegDistance();
        current.setArrivalFlag();
        vehicle.park();
        log.info("Arrived at {} ({}/{}), next leg {} miles", current.getName(),
                locationIndex + 1, trail.size(), legDistance);
        modes.addMode(current.getMode());
    }

    // ========================================================================
    // Route
    // ========================================================================

    /**
     * The location after the current one.
     *
     * @return the next location, empty at the last location or when the trail is complete
     */
    public Optional<Location> nextLocation() {
        if (trail == null || locationIndex + 1 >= trail.size()) {
            return Optional.empty();
        }
        return Optional.of(trail.getLocations().get(locationIndex + 1));
    }

    /**
     * Splice a location in right after the current one. Visited locations are untouched.
     *
     * @param location the location to visit next
     */
    public void insertLocation(Location location) {
        if (isTrailComplete()) {
            log.warn("Cannot insert {} into a completed trail", location.getName());
            return;
        }
        trail.insert(locationIndex + 1, location);
        log.info("Route changed: {} inserted after {}", location.getName(),
                trail.getLocations().get(locationIndex).getName());
    }

    /**
     * Leave the current location and start rolling toward the next one.
     */
    public void departCurrentLocation() {
        Location current = getCurrentLocation();
        if (current == null) {
            log.warn("Depart requested with no current location");
            return;
        }
        if (!current.setDepartedFlag()) {
            return;
        }
        distanceToNextLocation = legDistance;
        vehicle.resume();
        log.info("Departed {}, {} miles to go", current.getName(), distanceToNextLocation);
    }

    /**
     * Get a wagon that stopped between two locations rolling again.
     *
     * @return true if the wagon is moving again
     */
    public boolean resumeTravel() {
        if (!isStranded()) {
            return false;
        }
        if (vehicle.dailyMileage() <= 0) {
            log.info("Nothing to pull the wagon, still {} miles short", distanceToNextLocation);
            return false;
        }
        vehicle.resume();
        log.info("Back on the trail, {} miles to go", distanceToNextLocation);
        return true;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * Check if the wagon has stopped between locations, after leaving one and before
     * reaching the next.
     *
     * @return true while parked part way along a leg
     */
    public boolean isStranded() {
        Location current = getCurrentLocation();
        return current != null
                && current.getStatus() == LocationStatus.DEPARTED
                && vehicle.isParked()
                && distanceToNextLocation > 0;
    }

    /**
     * Check if the vehicle is parked at the location it last arrived at.
     *
     * @return true while waiting for the player to depart
     */
    public boolean reachedNextPoint() {
        Location current = getCurrentLocation();
        return current != null
                && current.getStatus() == LocationStatus.ARRIVED
                && vehicle.isParked();
    }

    /**
     * Check if the party is still at the start of the trail.
     *
     * @return true at index 0 before the first departure, with the vehicle parked
     */
    public boolean isFirstLocation() {
        Location current = getCurrentLocation();
        return locationIndex == 0
                && current != null
                && current.getStatus() != LocationStatus.DEPARTED
                && vehicle.isParked();
    }

    public boolean isTrailComplete() {
        return trail == null || locationIndex >= trail.size();
    }

    @Nullable
    public Location getCurrentLocation() {
        if (isTrailComplete()) {
            return null;
        }
        return trail.getLocations().get(locationIndex);
    }

    public List<Location> getLocations() {
        return trail == null ? Collections.emptyList() : trail.getLocations();
    }

    public int getTrailLength() {
        return trail == null ? 0 : trail.getTrailLength();
    }

    @Nullable
    public Trail getTrail() {
        return trail;
    }

    @Override
    public void destroy() {
        locationIndex = 0;
        distanceToNextLocation = 0;
        legDistance = 0;
        distanceAllotted = 0;
        trail = null;
    }

    private int generateLegDistance() {
        int remainingBudget = trail.getTrailLength() - distanceAllotted;
        // Legs still ahead, counting the one that leaves the last location.
        int remainingLegs = trail.size() - locationIndex;
        if (remainingBudget <= 0) {
            log.warn("Trail length {} exhausted at {}, using minimum leg",
                    trail.getTrailLength(), trail.getLocations().get(locationIndex).getName());
        }
        int distance = Math.max(1, distanceGenerator.generate(remainingBudget, remainingLegs));
        distanceAllotted += distance;
        return distance;
    }

    @Override
    public String toString() {
        return String.format("TrailModule[index=%d, distance=%d, leg=%d]",
                locationIndex, distanceToNextLocation, legDistance);
    }
}
