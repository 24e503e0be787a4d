package com.oregontrail.mode;

/**
 * Where simulation modules request new modes.
 */
public interface ModeStack {

    /**
     * Push a new mode of the given type on top of the stack.
     *
     * @param type the mode type
     */
    void addMode(ModeType type);
}
