package com.oregontrail.vehicle;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The party wagon: inventory, pace and whether it is currently rolling.
 *
 * <p>Inventory iteration follows {@link SimulationEntity} declaration order, so every
 * listing built from {@link #getInventory()} is stable.
 */
@Slf4j
public class Vehicle {

    private final Map<SimulationEntity, SimItem> inventory = new EnumMap<>(SimulationEntity.class);

    /**
     * Miles covered per day at a steady pace with oxen hitched.
     */
    @Getter
    private final int baseMileage;

    @Getter
    private TravelPace pace;

    /**
     * Parked vehicles cover no distance.
     */
    @Getter
    private boolean parked;

    /**
     * Total miles travelled since the start of the game.
     */
    @Getter
    private int odometer;

    public Vehicle(int baseMileage, TravelPace pace, Map<SimulationEntity, Double> startingInventory) {
        if (baseMileage < 0) {
            throw new IllegalArgumentException("Base mileage must not be negative: " + baseMileage);
        }
        this.baseMileage = baseMileage;
        this.pace = pace;
        this.parked = true;
        for (SimulationEntity entity : SimulationEntity.values()) {
            double quantity = startingInventory.getOrDefault(entity, 0.0);
            inventory.put(entity, new SimItem(entity, Math.max(0, quantity)));
        }
    }

    /**
     * Distance covered in one simulated day.
     *
     * @return 0 when parked or without oxen, otherwise base mileage scaled by pace
     */
    public int getMileage() {
        return parked ? 0 : dailyMileage();
    }

    /**
     * Miles a day the team could pull, whether or not the wagon is rolling.
     *
     * @return 0 without oxen
     */
    public int dailyMileage() {
        if (getQuantity(SimulationEntity.ANIMAL) <= 0) {
            return 0;
        }
        return (int) Math.round(baseMileage * pace.getMileageMultiplier());
    }

    public void park() {
        if (!parked) {
            log.debug("Vehicle parked after {} miles", odometer);
        }
        parked = true;
    }

    public void resume() {
        if (parked) {
            log.debug("Vehicle back on the trail");
        }
        parked = false;
    }

    public void setPace(TravelPace pace) {
        log.info("Pace changed: {} -> {}", this.pace, pace);
        this.pace = pace;
    }

    /**
     * Record distance actually covered.
     *
     * @param miles miles travelled, ignored when not positive
     */
    public void addMiles(int miles) {
        if (miles > 0) {
            odometer += miles;
        }
    }

    /**
     * Ordered, read-only view of the inventory.
     *
     * @return entity to item map in display order
     */
    public Map<SimulationEntity, SimItem> getInventory() {
        return Collections.unmodifiableMap(inventory);
    }

    public double getQuantity(SimulationEntity entity) {
        return inventory.get(entity).getQuantity();
    }

    public void addQuantity(SimulationEntity entity, double amount) {
        SimItem item = inventory.get(entity);
        inventory.put(entity, item.withQuantity(item.getQuantity() + amount));
    }

    /**
     * Remove up to {@code amount} of an entity.
     *
     * @param entity the entity
     * @param amount how much to remove
     * @return how much was actually removed
     */
    public double removeQuantity(SimulationEntity entity, double amount) {
        SimItem item = inventory.get(entity);
        double removed = Math.min(item.getQuantity(), Math.max(0, amount));
        inventory.put(entity, item.withQuantity(item.getQuantity() - removed));
        return removed;
    }
}
