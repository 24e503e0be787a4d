package com.oregontrail.core;

import com.google.gson.Gson;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.oregontrail.config.GameConfig;
import com.oregontrail.config.GameConfigLoader;
import com.oregontrail.data.GsonFactory;
import com.oregontrail.event.EventDirector;
import com.oregontrail.mode.ModeManager;
import com.oregontrail.mode.ModeStack;
import com.oregontrail.time.TimeModule;
import com.oregontrail.trail.DistanceGenerator;
import com.oregontrail.trail.FixedDistanceGenerator;
import com.oregontrail.trail.RandomizedDistanceGenerator;
import com.oregontrail.trail.Trail;
import com.oregontrail.trail.TrailModule;
import com.oregontrail.trail.TrailRegistry;
import com.oregontrail.util.Randomization;
import com.oregontrail.vehicle.Vehicle;
import lombok.extern.slf4j.Slf4j;

/**
 * Guice module for the game.
 *
 * Loads configuration and the trail definition and builds the simulation modules from them.
 */
@Slf4j
public class GameInjectorModule extends AbstractModule {

    private final String configResource;

    public GameInjectorModule() {
        this(GameConfigLoader.DEFAULT_RESOURCE);
    }

    public GameInjectorModule(String configResource) {
        this.configResource = configResource;
    }

    @Override
    protected void configure() {
        // Most bindings are @Singleton annotated on the classes themselves
        bind(ModeStack.class).to(ModeManager.class);
    }

    @Provides
    @Singleton
    public Gson provideGson() {
        return GsonFactory.create();
    }

    @Provides
    @Singleton
    public GameConfig provideGameConfig(Gson gson) {
        return GameConfigLoader.load(gson, configResource);
    }

    @Provides
    @Singleton
    public Randomization provideRandomization(GameConfig config) {
        if (config.getRandomSeed() != 0L) {
            log.info("Using random seed {}", config.getRandomSeed());
            return new Randomization(config.getRandomSeed());
        }
        return new Randomization();
    }

    @Provides
    @Singleton
    public Trail provideTrail(Gson gson, GameConfig config) {
        return TrailRegistry.load(gson, config.getTrailResource(), config.getLoadAttempts());
    }

    @Provides
    @Singleton
    public Vehicle provideVehicle(GameConfig config) {
        return new Vehicle(config.getBaseMileage(), config.getPace(), config.getStartingInventory());
    }

    @Provides
    @Singleton
    public TimeModule provideTimeModule(GameConfig config) {
        return new TimeModule(config.getStartDate());
    }

    @Provides
    @Singleton
    public DistanceGenerator provideDistanceGenerator(GameConfig config, Randomization randomization) {
        switch (config.getDistancePolicy()) {
            case RANDOMIZED:
                return new RandomizedDistanceGenerator(randomization);
            case FIXED:
            default:
                return new FixedDistanceGenerator(config.getFixedDistance());
        }
    }

    @Provides
    @Singleton
    public TrailModule provideTrailModule(Trail trail, Vehicle vehicle, TimeModule time, ModeStack modes,
                                          DistanceGenerator distanceGenerator) {
        return new TrailModule(trail, vehicle, time, modes, distanceGenerator);
    }

    @Provides
    @Singleton
    public EventDirector provideEventDirector(GameConfig config, Randomization randomization) {
        return new EventDirector(randomization, EventDirector.defaultEvents(randomization),
                config.isRandomEventsEnabled());
    }
}
