package com.oregontrail.mode;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.mode.impl.EndGameMode;
import com.oregontrail.mode.impl.LocationArrivalMode;
import com.oregontrail.mode.impl.TravelMode;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Provider;
import javax.inject.Singleton;

/**
 * Creates {@link GameMode} instances bound to the running simulation.
 */
@Slf4j
@Singleton
public class ModeFactory {

    /**
     * Provider to break the circular dependency between the simulation and its mode manager.
     */
    private final Provider<GameSimulation> simulationProvider;

    @Inject
    public ModeFactory(Provider<GameSimulation> simulationProvider) {
        this.simulationProvider = simulationProvider;
    }

    public GameMode create(ModeType type) {
        GameSimulation simulation = simulationProvider.get();
        switch (type) {
            case TRAVEL:
                return new TravelMode(simulation);
            case SETTLEMENT:
            case LANDMARK:
            case RIVER_CROSSING:
                return new LocationArrivalMode(type, simulation);
            case END_GAME:
                return new EndGameMode(simulation);
            default:
                throw new IllegalArgumentException("Unknown mode type: " + type);
        }
    }
}
