package com.oregontrail.mode;

/**
 * Kinds of game modes that can sit on the mode stack.
 */
public enum ModeType {

    /**
     * Travel menu and driving between locations. Always at the bottom of the stack.
     */
    TRAVEL,

    /**
     * Towns and forts.
     */
    SETTLEMENT,

    LANDMARK,

    RIVER_CROSSING,

    /**
     * Final screen. Any input ends the simulation.
     */
    END_GAME
}
