package com.oregontrail.mode;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.travel.CheckSuppliesState;
import com.oregontrail.travel.ContinueOnTrailState;
import com.oregontrail.travel.LocationDepart;
import com.oregontrail.travel.LocationFork;
import com.oregontrail.travel.LookAtMap;
import com.oregontrail.travel.RandomEventState;

import javax.inject.Inject;
import javax.inject.Provider;
import javax.inject.Singleton;

/**
 * Creates {@link Form} instances bound to the running simulation.
 */
@Singleton
public class FormFactory {

    private final Provider<GameSimulation> simulationProvider;

    @Inject
    public FormFactory(Provider<GameSimulation> simulationProvider) {
        this.simulationProvider = simulationProvider;
    }

    public Form create(FormKind kind) {
        GameSimulation simulation = simulationProvider.get();
        switch (kind) {
            case CONTINUE_ON_TRAIL:
                return new ContinueOnTrailState(simulation);
            case CHECK_SUPPLIES:
                return new CheckSuppliesState(simulation);
            case LOCATION_FORK:
                return new LocationFork(simulation);
            case LOCATION_DEPART:
                return new LocationDepart(simulation);
            case LOOK_AT_MAP:
                return new LookAtMap(simulation);
            case RANDOM_EVENT:
                return new RandomEventState(simulation);
            default:
                throw new IllegalArgumentException("Unknown form kind: " + kind);
        }
    }
}
