package com.oregontrail.trail;

import com.oregontrail.mode.ModeType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named point of interest on the trail.
 *
 * <p>Status changes are validated: only UNVISITED to ARRIVED and ARRIVED to DEPARTED
 * are accepted, anything else is logged and ignored.
 */
@Slf4j
public class Location {

    @Getter
    private final String name;

    /**
     * Mode pushed onto the mode stack when the vehicle arrives here.
     */
    @Getter
    private final ModeType mode;

    /**
     * Alternate locations offered when the trail forks here, fixed when the trail is authored.
     */
    @Getter
    private final List<Location> skipChoices;

    @Getter
    private LocationStatus status = LocationStatus.UNVISITED;

    public Location(String name, ModeType mode) {
        this(name, mode, Collections.emptyList());
    }

    public Location(String name, ModeType mode, List<Location> skipChoices) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Location name must not be blank");
        }
        this.name = name;
        this.mode = Objects.requireNonNull(mode, "mode");
        this.skipChoices = Collections.unmodifiableList(new ArrayList<>(skipChoices));
    }

    /**
     * Check if the trail divides here.
     *
     * @return true if this location offers skip choices
     */
    public boolean isFork() {
        return !skipChoices.isEmpty();
    }

    public boolean setArrivalFlag() {
        return transitionTo(LocationStatus.ARRIVED);
    }

    public boolean setDepartedFlag() {
        return transitionTo(LocationStatus.DEPARTED);
    }

    private boolean transitionTo(LocationStatus next) {
        if (!status.canTransitionTo(next)) {
            log.warn("Invalid location transition attempted: {} -> {} for {}", status, next, name);
            return false;
        }
        log.debug("Location '{}' transitioned: {} -> {}", name, status, next);
        status = next;
        return true;
    }

    @Override
    public String toString() {
        return String.format("Location[%s, status=%s, mode=%s]", name, status, mode);
    }
}
