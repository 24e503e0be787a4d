package com.oregontrail.event.impl;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.event.AbstractRandomEvent;
import com.oregontrail.event.EventCategory;
import com.oregontrail.vehicle.SimulationEntity;

/**
 * A wagon wheel breaks. A spare replaces it, otherwise the party loses a day on repairs.
 */
public class BrokenWheelEvent extends AbstractRandomEvent {

    static final double ROLL_CHANCE = 0.02;

    static final int REPAIR_DAYS = 1;

    public BrokenWheelEvent() {
        super("Broken wheel", EventCategory.VEHICLE, ROLL_CHANCE);
    }

    @Override
    public String execute(GameSimulation simulation) {
        if (simulation.getVehicle().removeQuantity(SimulationEntity.WHEEL, 1) > 0) {
            return "A wagon wheel broke. You replace it with a spare.";
        }
        simulation.getTime().skipDays(REPAIR_DAYS);
        return "A wagon wheel broke. You lose a day repairing it.";
    }
}
