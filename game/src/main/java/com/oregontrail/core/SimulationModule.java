package com.oregontrail.core;

/**
 * A piece of simulation state that advances with the game clock.
 *
 * <p>Execution Model:
 * <ul>
 *   <li>{@link #onTick(boolean)} is called by {@link GameSimulation} in a fixed module order</li>
 *   <li>System ticks arrive at unpredictable rates from the host loop; fixed ticks are one game day</li>
 *   <li>Every call runs to completion on the game thread before the next one starts</li>
 * </ul>
 */
public interface SimulationModule {

    /**
     * Advance the module.
     *
     * @param systemTick true if ticked by the host loop, false if pulsed at the fixed day interval
     */
    void onTick(boolean systemTick);

    /**
     * Release everything the module created so the simulation can shut down cleanly.
     */
    void destroy();
}
