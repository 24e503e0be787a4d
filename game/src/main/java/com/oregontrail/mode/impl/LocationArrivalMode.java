package com.oregontrail.mode.impl;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.mode.DialogResponse;
import com.oregontrail.mode.DialogState;
import com.oregontrail.mode.GameMode;
import com.oregontrail.mode.ModeType;
import com.oregontrail.mode.Transition;
import com.oregontrail.trail.Location;

/**
 * Announces arrival at a settlement, landmark or river crossing. Any input returns to travel.
 */
public class LocationArrivalMode extends GameMode {

    public LocationArrivalMode(ModeType type, GameSimulation simulation) {
        super(type, simulation);
    }

    @Override
    protected String onRenderMode() {
        Location current = simulation.getTrail().getCurrentLocation();
        String name = current == null ? "the trail" : current.getName();
        return "\n" + describe(name) + "\n\n"
                + simulation.getTime().getFormattedDate() + "\n\n"
                + DialogState.CONTINUE_FOOTER;
    }

    @Override
    protected Transition onModeInput(DialogResponse response) {
        return Transition.closeMode();
    }

    private String describe(String name) {
        switch (getType()) {
            case SETTLEMENT:
                return "You have arrived at " + name + ".";
            case RIVER_CROSSING:
                return "You have reached " + name + ". The ferry takes your wagon across.";
            case LANDMARK:
            default:
                return "You are now at " + name + ".";
        }
    }
}
