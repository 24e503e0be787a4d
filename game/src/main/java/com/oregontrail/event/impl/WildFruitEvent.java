package com.oregontrail.event.impl;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.event.AbstractRandomEvent;
import com.oregontrail.event.EventCategory;
import com.oregontrail.util.Randomization;
import com.oregontrail.vehicle.SimulationEntity;

public class WildFruitEvent extends AbstractRandomEvent {

    static final double ROLL_CHANCE = 0.03;

    static final int MIN_FOUND = 10;

    static final int MAX_FOUND = 30;

    private final Randomization randomization;

    public WildFruitEvent(Randomization randomization) {
        super("Wild fruit", EventCategory.WILD, ROLL_CHANCE);
        this.randomization = randomization;
    }

    @Override
    public String execute(GameSimulation simulation) {
        int amount = randomization.uniformRandomInt(MIN_FOUND, MAX_FOUND);
        simulation.getVehicle().addQuantity(SimulationEntity.FOOD, amount);
        return String.format("You find wild fruit along the trail and gather %d pounds.", amount);
    }
}
