package com.oregontrail.config;

import com.oregontrail.vehicle.SimulationEntity;
import com.oregontrail.vehicle.TravelPace;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable game settings, loaded from {@code /config/game.json} by {@link GameConfigLoader}.
 * Every field has a default so a partial file is valid.
 */
@Value
@Builder(toBuilder = true)
public class GameConfig {

    public static final String DEFAULT_TRAIL_RESOURCE = "/trails/oregon_trail.json";

    public static final LocalDate DEFAULT_START_DATE = LocalDate.of(1848, 3, 1);

    /**
     * Defaults for everything.
     */
    public static final GameConfig DEFAULTS = GameConfig.builder().build();

    /**
     * Classpath resource holding the trail definition.
     */
    @Builder.Default
    String trailResource = DEFAULT_TRAIL_RESOURCE;

    @Builder.Default
    LocalDate startDate = DEFAULT_START_DATE;

    /**
     * Miles per day at a steady pace.
     */
    @Builder.Default
    int baseMileage = 20;

    @Builder.Default
    TravelPace pace = TravelPace.STEADY;

    @Builder.Default
    DistancePolicy distancePolicy = DistancePolicy.FIXED;

    /**
     * Leg length used by {@link DistancePolicy#FIXED}.
     */
    @Builder.Default
    int fixedDistance = 1;

    /**
     * Seed for the random source. 0 means unseeded.
     */
    @Builder.Default
    long randomSeed = 0L;

    @Builder.Default
    boolean randomEventsEnabled = true;

    /**
     * Number of attempts when loading JSON resources.
     */
    @Builder.Default
    int loadAttempts = 3;

    @Builder.Default
    Map<SimulationEntity, Double> startingInventory = defaultInventory();

    private static Map<SimulationEntity, Double> defaultInventory() {
        Map<SimulationEntity, Double> inventory = new EnumMap<>(SimulationEntity.class);
        inventory.put(SimulationEntity.ANIMAL, 6.0);
        inventory.put(SimulationEntity.CLOTHING, 10.0);
        inventory.put(SimulationEntity.AMMO, 200.0);
        inventory.put(SimulationEntity.WHEEL, 2.0);
        inventory.put(SimulationEntity.AXLE, 2.0);
        inventory.put(SimulationEntity.TONGUE, 2.0);
        inventory.put(SimulationEntity.FOOD, 1000.0);
        inventory.put(SimulationEntity.CASH, 400.0);
        return Collections.unmodifiableMap(inventory);
    }
}
