package com.oregontrail.mode;

import com.oregontrail.core.GameSimulation;

/**
 * A form that shows one prompt and closes on any acknowledgment.
 *
 * <p>Subclasses must implement:
 * <ul>
 *   <li>{@link #onDialogPrompt()} - the prompt text</li>
 *   <li>{@link #onDialogResponse(DialogResponse)} - what the acknowledgment does</li>
 * </ul>
 */
public abstract class DialogState extends AbstractForm {

    public static final String CONTINUE_FOOTER = "Press ENTER KEY to continue.";

    protected DialogState(FormKind kind, GameSimulation simulation) {
        super(kind, simulation);
    }

    /**
     * Fired when the dialog is rendered.
     *
     * @return the prompt text without the footer
     */
    protected abstract String onDialogPrompt();

    /**
     * Fired when the player acknowledges the dialog.
     *
     * @param response the parsed input
     * @return the transition to apply
     */
    protected abstract Transition onDialogResponse(DialogResponse response);

    @Override
    public final String render() {
        return onDialogPrompt() + CONTINUE_FOOTER;
    }

    @Override
    public final Transition onInputBufferReturned(String input) {
        return onDialogResponse(DialogResponse.parse(input));
    }
}
