package com.oregontrail.travel;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.mode.AbstractForm;
import com.oregontrail.mode.DialogResponse;
import com.oregontrail.mode.FormKind;
import com.oregontrail.mode.Transition;
import com.oregontrail.trail.Location;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * The trail divides at the current location. The player picks one of its skip choices,
 * which is visited next, or asks to see the map.
 *
 * <p>Choices are numbered from 1 in the order the location lists them. The number after
 * the last choice opens the map, and so does any other number outside the choices.
 */
@Slf4j
public class LocationFork extends AbstractForm {

    private Map<Integer, Location> skipChoices = Collections.emptyMap();

    public LocationFork(GameSimulation simulation) {
        super(FormKind.LOCATION_FORK, simulation);
    }

    @Override
    public void onFormPostCreate() {
        Location current = simulation.getTrail().getCurrentLocation();
        if (current == null) {
            throw new IllegalStateException("Fork opened without a current location");
        }
        Map<Integer, Location> choices = new LinkedHashMap<>();
        List<Location> options = current.getSkipChoices();
        for (int index = 0; index < options.size(); index++) {
            choices.put(index + 1, options.get(index));
        }
        skipChoices = Collections.unmodifiableMap(choices);
    }

    @Override
    public String render() {
        StringBuilder prompt = new StringBuilder("\nThe trail divides here. You may:\n\n");
        for (Map.Entry<Integer, Location> choice : skipChoices.entrySet()) {
            prompt.append("  ").append(choice.getKey()).append(". head for ")
                    .append(choice.getValue().getName()).append('\n');
        }
        prompt.append("  ").append(skipChoices.size() + 1).append(". see the map");
        return prompt.toString();
    }

    @Override
    public Transition onInputBufferReturned(String input) {
        OptionalInt choice = DialogResponse.parse(input).getPositiveNumber();
        if (choice.isEmpty()) {
            return Transition.none();
        }

        Location selected = skipChoices.get(choice.getAsInt());
        if (selected == null) {
            return Transition.openForm(FormKind.LOOK_AT_MAP);
        }

        log.debug("Fork choice {}: {}", choice.getAsInt(), selected.getName());
        simulation.getTrail().insertLocation(selected);
        return Transition.openForm(FormKind.LOCATION_DEPART);
    }

    /**
     * Choices offered by this fork, keyed by their menu number.
     *
     * @return read-only choice map
     */
    public Map<Integer, Location> getSkipChoices() {
        return skipChoices;
    }
}
