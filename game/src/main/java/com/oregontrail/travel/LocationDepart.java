package com.oregontrail.travel;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.mode.DialogResponse;
import com.oregontrail.mode.DialogState;
import com.oregontrail.mode.FormKind;
import com.oregontrail.mode.Transition;
import com.oregontrail.trail.Location;

/**
 * Confirms the route picked at a fork, then departs.
 */
public class LocationDepart extends DialogState {

    public LocationDepart(GameSimulation simulation) {
        super(FormKind.LOCATION_DEPART, simulation);
    }

    @Override
    protected String onDialogPrompt() {
        String next = simulation.getTrail().nextLocation()
                .map(Location::getName)
                .orElse("the end of the trail");
        return "\nYou have decided to head for " + next + ".\n\n";
    }

    @Override
    protected Transition onDialogResponse(DialogResponse response) {
        simulation.getTrail().departCurrentLocation();
        return Transition.closeForm();
    }
}
