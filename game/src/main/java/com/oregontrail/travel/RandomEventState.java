package com.oregontrail.travel;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.mode.DialogResponse;
import com.oregontrail.mode.DialogState;
import com.oregontrail.mode.FormKind;
import com.oregontrail.mode.Transition;

/**
 * Shows what just happened on the trail.
 */
public class RandomEventState extends DialogState {

    public RandomEventState(GameSimulation simulation) {
        super(FormKind.RANDOM_EVENT, simulation);
    }

    @Override
    protected String onDialogPrompt() {
        String message = simulation.getEvents().getLastMessage();
        return "\n" + simulation.getTime().getFormattedDate() + "\n\n"
                + (message == null ? "Nothing happens." : message) + "\n\n";
    }

    @Override
    protected Transition onDialogResponse(DialogResponse response) {
        return Transition.closeForm();
    }
}
