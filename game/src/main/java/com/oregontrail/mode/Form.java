package com.oregontrail.mode;

/**
 * A unit of interactive UI state attached to a game mode.
 *
 * <p>Forms render a text block and interpret one line of player input at a time.
 * They report what should happen next through a {@link Transition} and never
 * modify the mode stack themselves.
 */
public interface Form {

    /**
     * Which form this is.
     *
     * @return the form kind
     */
    FormKind getKind();

    /**
     * Called once after the form has been attached to its mode.
     * Use it to read simulation data the form needs for its lifetime.
     */
    default void onFormPostCreate() {
    }

    /**
     * Text representation of the form. Must return the same text until new input arrives.
     *
     * @return the prompt text
     */
    String render();

    /**
     * Handle a line of player input.
     *
     * @param input the raw input line, never null
     * @return the transition to apply, {@link Transition#none()} to ignore the input
     */
    Transition onInputBufferReturned(String input);
}
