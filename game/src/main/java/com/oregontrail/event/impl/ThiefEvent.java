package com.oregontrail.event.impl;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.event.AbstractRandomEvent;
import com.oregontrail.event.EventCategory;
import com.oregontrail.util.Randomization;
import com.oregontrail.vehicle.SimulationEntity;

/**
 * A thief steals food during the night.
 */
public class ThiefEvent extends AbstractRandomEvent {

    static final double ROLL_CHANCE = 0.02;

    static final int MIN_STOLEN = 10;

    static final int MAX_STOLEN = 50;

    private final Randomization randomization;

    public ThiefEvent(Randomization randomization) {
        super("Thief", EventCategory.PERSON, ROLL_CHANCE);
        this.randomization = randomization;
    }

    @Override
    public String execute(GameSimulation simulation) {
        int amount = randomization.uniformRandomInt(MIN_STOLEN, MAX_STOLEN);
        double stolen = simulation.getVehicle().removeQuantity(SimulationEntity.FOOD, amount);
        if (stolen <= 0) {
            return "A thief comes during the night but finds nothing to take.";
        }
        return String.format("A thief comes during the night and steals %d pounds of food.",
                (int) Math.round(stolen));
    }
}
