package com.oregontrail.event;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.util.Randomization;

/**
 * Something that may happen to the party while the wagon is rolling.
 */
public interface RandomEvent {

    String getName();

    EventCategory getCategory();

    /**
     * Probability, from 0.0 to 1.0, that the event fires on a given day of travel.
     *
     * @return the roll chance
     */
    double getRollChance();

    /**
     * Number of times this event has been rolled for.
     *
     * @return the roll count
     */
    int getRollCount();

    /**
     * Roll the dice for this event.
     *
     * @param randomization random source
     * @return true if the event fires
     */
    boolean roll(Randomization randomization);

    /**
     * Apply the event to the simulation.
     *
     * @param simulation the running game
     * @return the message shown to the player
     */
    String execute(GameSimulation simulation);
}
