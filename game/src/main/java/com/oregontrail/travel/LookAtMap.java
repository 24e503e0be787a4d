package com.oregontrail.travel;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.mode.DialogResponse;
import com.oregontrail.mode.DialogState;
import com.oregontrail.mode.FormKind;
import com.oregontrail.mode.Transition;
import com.oregontrail.trail.Location;
import com.oregontrail.trail.TrailModule;

import java.util.List;

/**
 * Text map of the trail: every location with its visit marker and where the wagon is.
 * Acknowledging returns to the form that opened the map, if any.
 */
public class LookAtMap extends DialogState {

    public LookAtMap(GameSimulation simulation) {
        super(FormKind.LOOK_AT_MAP, simulation);
    }

    @Override
    protected String onDialogPrompt() {
        TrailModule trail = simulation.getTrail();
        List<Location> locations = trail.getLocations();
        String trailName = trail.getTrail() == null ? "Trail" : trail.getTrail().getName();

        StringBuilder map = new StringBuilder("\n").append(trailName).append(" map\n\n");
        for (int index = 0; index < locations.size(); index++) {
            Location location = locations.get(index);
            map.append("  [").append(location.getStatus().getMarker()).append("] ")
                    .append(location.getName());
            if (index == trail.getLocationIndex()) {
                map.append(simulation.getVehicle().isParked() ? "  <- you are here" : "  <- last stop");
            }
            map.append('\n');
        }
        map.append('\n')
                .append(simulation.getVehicle().getOdometer()).append(" miles traveled, ")
                .append(trail.getDistanceToNextLocation()).append(" miles to the next stop\n\n");
        return map.toString();
    }

    @Override
    protected Transition onDialogResponse(DialogResponse response) {
        return Transition.back();
    }
}
