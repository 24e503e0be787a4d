package com.oregontrail.travel;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.mode.DialogResponse;
import com.oregontrail.mode.DialogState;
import com.oregontrail.mode.FormKind;
import com.oregontrail.mode.Transition;
import com.oregontrail.vehicle.SimItem;
import com.oregontrail.vehicle.SimulationEntity;

import java.text.NumberFormat;
import java.util.Locale;

/**
 * Lists everything in the wagon along with the money the party has left. Read-only.
 */
public class CheckSuppliesState extends DialogState {

    private static final int NAME_WIDTH = 15;

    private static final int QUANTITY_WIDTH = 3;

    public CheckSuppliesState(GameSimulation simulation) {
        super(FormKind.CHECK_SUPPLIES, simulation);
    }

    @Override
    protected String onDialogPrompt() {
        StringBuilder supplies = new StringBuilder("\nYour Supplies\n\n");
        for (SimItem item : simulation.getVehicle().getInventory().values()) {
            supplies.append(String.format("%-" + NAME_WIDTH + "s %" + QUANTITY_WIDTH + "s\n",
                    item.getName().toLowerCase(Locale.ROOT), formatQuantity(item)));
        }
        return supplies.toString();
    }

    @Override
    protected Transition onDialogResponse(DialogResponse response) {
        return Transition.closeForm();
    }

    static String formatQuantity(SimItem item) {
        if (item.getCategory() == SimulationEntity.CASH) {
            return NumberFormat.getCurrencyInstance(Locale.US).format(item.getQuantity());
        }
        NumberFormat integer = NumberFormat.getIntegerInstance(Locale.US);
        integer.setGroupingUsed(true);
        return integer.format(item.getQuantity());
    }
}
