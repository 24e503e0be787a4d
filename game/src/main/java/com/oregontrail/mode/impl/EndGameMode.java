package com.oregontrail.mode.impl;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.event.EventHistoryItem;
import com.oregontrail.mode.DialogResponse;
import com.oregontrail.mode.GameMode;
import com.oregontrail.mode.ModeManager;
import com.oregontrail.mode.ModeType;
import com.oregontrail.mode.Transition;
import com.oregontrail.time.TimeModule;
import com.oregontrail.trail.Location;
import com.oregontrail.trail.TrailModule;

import java.util.List;

/**
 * Final summary. Any input ends the simulation.
 */
public class EndGameMode extends GameMode {

    static final String END_FOOTER = "Press ENTER KEY to end the game.";

    public EndGameMode(GameSimulation simulation) {
        super(ModeType.END_GAME, simulation);
    }

    @Override
    protected String onRenderMode() {
        StringBuilder summary = new StringBuilder()
                .append("\nCongratulations! You have reached ").append(destination()).append(" on ")
                .append(simulation.getTime().getFormattedDate()).append(".\n\n")
                .append("You traveled ").append(simulation.getVehicle().getOdometer()).append(" miles in ")
                .append(simulation.getTime().getTotalTurns()).append(" days.\n");

        ModeManager modes = simulation.getModes();
        summary.append(String.format("Stops: %d settlements, %d landmarks, %d river crossings.\n",
                modes.getRunCount(ModeType.SETTLEMENT),
                modes.getRunCount(ModeType.LANDMARK),
                modes.getRunCount(ModeType.RIVER_CROSSING)));

        List<EventHistoryItem> history = simulation.getEvents().getHistory();
        if (!history.isEmpty()) {
            summary.append("\nAlong the way:\n");
            for (EventHistoryItem item : history) {
                summary.append(String.format("  %-18s %s\n", TimeModule.formatDate(item.getTimestamp()),
                        item.getEventName()));
            }
        }

        return summary.append('\n').append(END_FOOTER).toString();
    }

    @Override
    protected Transition onModeInput(DialogResponse response) {
        return Transition.endSimulation();
    }

    private String destination() {
        TrailModule trail = simulation.getTrail();
        Location current = trail.getCurrentLocation();
        if (current != null) {
            return current.getName();
        }
        List<Location> locations = trail.getLocations();
        return locations.isEmpty() ? "the end of the trail" : locations.get(locations.size() - 1).getName();
    }
}
