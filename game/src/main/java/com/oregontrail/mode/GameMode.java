package com.oregontrail.mode;

import com.oregontrail.core.GameSimulation;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;

/**
 * A mode on the mode stack. Renders its own screen unless a form is attached,
 * in which case rendering and input go to the form.
 */
@Slf4j
public abstract class GameMode {

    @Getter
    private final ModeType type;

    protected final GameSimulation simulation;

    @Getter
    @Nullable
    private Form currentForm;

    /**
     * Kind of the form that was attached before the current one, for {@link Transition#back()}.
     */
    @Getter
    @Nullable
    private FormKind previousFormKind;

    protected GameMode(ModeType type, GameSimulation simulation) {
        this.type = type;
        this.simulation = simulation;
    }

    /**
     * Mode screen shown when no form is attached.
     *
     * @return the screen text
     */
    protected abstract String onRenderMode();

    /**
     * Handle input when no form is attached.
     *
     * @param response the parsed input
     * @return the transition to apply
     */
    protected abstract Transition onModeInput(DialogResponse response);

    public final String render() {
        if (currentForm != null) {
            return currentForm.render();
        }
        return onRenderMode();
    }

    public final Transition sendInput(String input) {
        if (currentForm != null) {
            return currentForm.onInputBufferReturned(input == null ? "" : input);
        }
        return onModeInput(DialogResponse.parse(input));
    }

    public boolean hasForm() {
        return currentForm != null;
    }

    void attachForm(Form form) {
        previousFormKind = currentForm != null ? currentForm.getKind() : null;
        currentForm = form;
        log.debug("Mode {} attached form {}", type, form.getKind());
        form.onFormPostCreate();
    }

    void clearForm() {
        if (currentForm != null) {
            log.debug("Mode {} closed form {}", type, currentForm.getKind());
        }
        currentForm = null;
        previousFormKind = null;
    }

    @Override
    public String toString() {
        return String.format("%s[type=%s, form=%s]", getClass().getSimpleName(), type,
                currentForm != null ? currentForm.getKind() : "none");
    }
}
