package com.oregontrail.mode.impl;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.mode.DialogResponse;
import com.oregontrail.mode.FormKind;
import com.oregontrail.mode.GameMode;
import com.oregontrail.mode.ModeType;
import com.oregontrail.mode.Transition;
import com.oregontrail.trail.Location;
import com.oregontrail.trail.TrailModule;

import java.util.OptionalInt;

/**
 * Base mode of the game. Shows the travel menu while the wagon is parked and a status
 * line while it rolls.
 */
public class TravelMode extends GameMode {

    static final int CONTINUE_ON_TRAIL = 1;
    static final int CHECK_SUPPLIES = 2;
    static final int LOOK_AT_MAP = 3;

    public TravelMode(GameSimulation simulation) {
        super(ModeType.TRAVEL, simulation);
    }

    @Override
    protected String onRenderMode() {
        TrailModule trail = simulation.getTrail();
        String next = trail.nextLocation().map(Location::getName).orElse("the end of the trail");
        StringBuilder screen = new StringBuilder("\n")
                .append(simulation.getTime().getFormattedDate()).append('\n');

        if (simulation.isVehicleMoving()) {
            return screen.append("Traveling to ").append(next).append(", ")
                    .append(trail.getDistanceToNextLocation()).append(" miles to go\n")
                    .append("Miles traveled: ").append(simulation.getVehicle().getOdometer()).append('\n')
                    .toString();
        }

        if (trail.isStranded()) {
            screen.append("Stopped on the trail, ").append(trail.getDistanceToNextLocation())
                    .append(" miles to ").append(next).append('\n');
            if (simulation.getVehicle().dailyMileage() <= 0) {
                screen.append("You have no oxen to pull the wagon.\n");
            }
        } else {
            Location current = trail.getCurrentLocation();
            if (current != null) {
                screen.append(current.getName()).append('\n');
            }
            screen.append("Next landmark: ").append(next).append(" (")
                    .append(trail.getLegDistance()).append(" miles)\n");
        }
        screen.append("Miles traveled: ").append(simulation.getVehicle().getOdometer()).append("\n\n")
                .append("  ").append(CONTINUE_ON_TRAIL).append(". ")
                .append(trail.isFirstLocation() ? "Start on the trail" : "Continue on trail").append('\n')
                .append("  ").append(CHECK_SUPPLIES).append(". Check supplies\n")
                .append("  ").append(LOOK_AT_MAP).append(". Look at map\n")
                .append("What is your choice?");
        return screen.toString();
    }

    @Override
    protected Transition onModeInput(DialogResponse response) {
        if (simulation.isVehicleMoving()) {
            return Transition.none();
        }
        OptionalInt choice = response.getPositiveNumber();
        if (choice.isEmpty()) {
            return Transition.none();
        }
        switch (choice.getAsInt()) {
            case CONTINUE_ON_TRAIL:
                return continueOnTrail();
            case CHECK_SUPPLIES:
                return Transition.openForm(FormKind.CHECK_SUPPLIES);
            case LOOK_AT_MAP:
                return Transition.openForm(FormKind.LOOK_AT_MAP);
            default:
                return Transition.none();
        }
    }

    private Transition continueOnTrail() {
        TrailModule trail = simulation.getTrail();
        if (trail.isStranded()) {
            trail.resumeTravel();
            return Transition.none();
        }
        Location current = trail.getCurrentLocation();
        if (current == null) {
            return Transition.none();
        }
        if (current.isFork()) {
            return Transition.openForm(FormKind.LOCATION_FORK);
        }
        return Transition.openForm(FormKind.CONTINUE_ON_TRAIL);
    }
}
