package com.oregontrail.core;

import com.oregontrail.config.GameConfig;
import com.oregontrail.event.EventDirector;
import com.oregontrail.event.EventHistoryItem;
import com.oregontrail.mode.FormKind;
import com.oregontrail.mode.GameMode;
import com.oregontrail.mode.ModeManager;
import com.oregontrail.mode.ModeType;
import com.oregontrail.mode.Transition;
import com.oregontrail.time.TimeModule;
import com.oregontrail.trail.TrailModule;
import com.oregontrail.vehicle.Vehicle;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.Optional;

/**
 * The running game. Owns every module and is handed to modes, forms and events
 * so they can read and change game state.
 *
 * <p>Fixed ticks run the modules in this order: trail, time, events. The trail goes
 * first so the opening tick arrives at the first location before any turn is counted.
 */
@Slf4j
@Singleton
public class GameSimulation {

    @Getter
    private final GameConfig config;

    @Getter
    private final TimeModule time;

    @Getter
    private final Vehicle vehicle;

    @Getter
    private final TrailModule trail;

    @Getter
    private final ModeManager modes;

    @Getter
    private final EventDirector events;

    private boolean started;

    private boolean destroyed;

    @Inject
    public GameSimulation(GameConfig config, TimeModule time, Vehicle vehicle, TrailModule trail,
                          ModeManager modes, EventDirector events) {
        this.config = config;
        this.time = time;
        this.vehicle = vehicle;
        this.trail = trail;
        this.modes = modes;
        this.events = events;
    }

    /**
     * Push the travel mode and run the opening tick.
     *
     * @throws IllegalStateException if the simulation was already started
     */
    public void start() {
        if (started) {
            throw new IllegalStateException("Simulation already started");
        }
        started = true;
        log.info("Starting simulation on {} with {} locations",
                time.getFormattedDate(), trail.getLocations().size());
        modes.addMode(ModeType.TRAVEL);
        tick(false);
    }

    /**
     * Advance every module once.
     *
     * @param systemTick true for host loop ticks, false for a fixed one-day tick
     */
    public void tick(boolean systemTick) {
        if (destroyed) {
            return;
        }
        if (isVehicleMoving() && vehicle.getMileage() == 0) {
            log.warn("Nothing left to pull the wagon, stopping {} miles short of the next location",
                    trail.getDistanceToNextLocation());
            vehicle.park();
        }
        boolean moving = isVehicleMoving();
        int before = trail.getDistanceToNextLocation();

        trail.onTick(systemTick);
        time.onTick(systemTick);

        if (moving) {
            vehicle.addMiles(before - trail.getDistanceToNextLocation());
        }

        if (!systemTick && isVehicleMoving() && modes.isActiveMode(ModeType.TRAVEL)) {
            Optional<EventHistoryItem> event = events.roll(this);
            if (event.isPresent()) {
                modes.openForm(FormKind.RANDOM_EVENT);
            }
        }
    }

    public boolean isVehicleMoving() {
        return !vehicle.isParked();
    }

    /**
     * Check if the game loop should keep ticking without player input: the wagon is
     * rolling and the travel screen has nothing for the player to answer.
     *
     * @return true while travelling uninterrupted
     */
    public boolean isTraveling() {
        GameMode active = modes.getActiveMode();
        return !isClosed()
                && isVehicleMoving()
                && active != null
                && active.getType() == ModeType.TRAVEL
                && !active.hasForm();
    }

    /**
     * Hand a line of player input to the active mode.
     *
     * @param input the raw line
     * @return the transition that was applied
     */
    public Transition submitInput(String input) {
        if (isClosed()) {
            return Transition.none();
        }
        return modes.sendInput(input);
    }

    public String render() {
        return modes.render();
    }

    public boolean isClosed() {
        return destroyed || modes.isExitRequested() || (started && modes.getStackDepth() == 0);
    }

    public void destroy() {
        if (destroyed) {
            return;
        }
        log.info("Simulation ended on {} after {} miles", time.getFormattedDate(), vehicle.getOdometer());
        trail.destroy();
        time.destroy();
        events.destroy();
        modes.clear();
        destroyed = true;
    }
}
