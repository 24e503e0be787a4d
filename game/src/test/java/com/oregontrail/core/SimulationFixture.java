package com.oregontrail.core;

import com.oregontrail.config.GameConfig;
import com.oregontrail.event.EventDirector;
import com.oregontrail.event.RandomEvent;
import com.oregontrail.mode.FormFactory;
import com.oregontrail.mode.ModeFactory;
import com.oregontrail.mode.ModeManager;
import com.oregontrail.mode.ModeType;
import com.oregontrail.time.TimeModule;
import com.oregontrail.trail.DistanceGenerator;
import com.oregontrail.trail.Location;
import com.oregontrail.trail.Trail;
import com.oregontrail.trail.TrailModule;
import com.oregontrail.util.Randomization;
import com.oregontrail.vehicle.Vehicle;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wires a {@link GameSimulation} by hand, the same way {@link GameInjectorModule} does.
 */
public final class SimulationFixture {

    private SimulationFixture() {
    }

    /**
     * Three stops, a fork in the middle, the last one ends the game.
     */
    public static Trail forkTrail() {
        Location fork = new Location("Split Rock", ModeType.LANDMARK, Arrays.asList(
                new Location("North Ford", ModeType.RIVER_CROSSING),
                new Location("South Fort", ModeType.SETTLEMENT)));
        return new Trail("Test Trail", Arrays.asList(
                new Location("Start Town", ModeType.SETTLEMENT),
                fork,
                new Location("Journey's End", ModeType.END_GAME)), 100);
    }

    public static GameSimulation create(Trail trail, GameConfig config, DistanceGenerator distanceGenerator) {
        return create(trail, config, distanceGenerator, Collections.emptyList());
    }

    public static GameSimulation create(Trail trail, GameConfig config, DistanceGenerator distanceGenerator,
                                        List<RandomEvent> events) {
        AtomicReference<GameSimulation> holder = new AtomicReference<>();
        ModeManager modes = new ModeManager(new ModeFactory(holder::get), new FormFactory(holder::get));
        Vehicle vehicle = new Vehicle(config.getBaseMileage(), config.getPace(), config.getStartingInventory());
        TimeModule time = new TimeModule(config.getStartDate());
        TrailModule trailModule = new TrailModule(trail, vehicle, time, modes, distanceGenerator);
        EventDirector director = new EventDirector(new Randomization(7L), events, !events.isEmpty());
        GameSimulation simulation = new GameSimulation(config, time, vehicle, trailModule, modes, director);
        holder.set(simulation);
        return simulation;
    }
}
