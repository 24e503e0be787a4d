package com.oregontrail.travel;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.mode.DialogResponse;
import com.oregontrail.mode.DialogState;
import com.oregontrail.mode.FormKind;
import com.oregontrail.mode.Transition;
import com.oregontrail.trail.Location;
import com.oregontrail.trail.TrailModule;

/**
 * Tells the player how far the next location is. Acknowledging it leaves the
 * current location and puts the wagon back on the trail.
 */
public class ContinueOnTrailState extends DialogState {

    public ContinueOnTrailState(GameSimulation simulation) {
        super(FormKind.CONTINUE_ON_TRAIL, simulation);
    }

    @Override
    protected String onDialogPrompt() {
        TrailModule trail = simulation.getTrail();
        Location current = trail.getCurrentLocation();
        String from = current == null ? "here" : current.getName();
        String to = trail.nextLocation().map(Location::getName).orElse("end of the trail");
        return "\nFrom " + from + " it is " + trail.getLegDistance()
                + "\nmiles to the " + to + "\n\n";
    }

    @Override
    protected Transition onDialogResponse(DialogResponse response) {
        simulation.getTrail().departCurrentLocation();
        return Transition.closeForm();
    }
}
