package com.oregontrail.mode;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * Command returned by modes and forms after handling input, applied by
 * {@link ModeManager#apply(Transition)}. Forms never edit the mode stack directly.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Transition {

    public enum Type {
        /** Input ignored, nothing changes. */
        NONE,
        /** Detach the form from the active mode. */
        CLOSE_FORM,
        /** Attach a new form to the active mode. */
        OPEN_FORM,
        /** Reattach the form that opened the current one, or close if there was none. */
        BACK,
        /** Pop the active mode. */
        CLOSE_MODE,
        /** Push a new mode. */
        ADD_MODE,
        /** Stop the game loop. */
        END_SIMULATION
    }

    private static final Transition NONE = new Transition(Type.NONE, null, null);
    private static final Transition CLOSE_FORM = new Transition(Type.CLOSE_FORM, null, null);
    private static final Transition BACK = new Transition(Type.BACK, null, null);
    private static final Transition CLOSE_MODE = new Transition(Type.CLOSE_MODE, null, null);
    private static final Transition END_SIMULATION = new Transition(Type.END_SIMULATION, null, null);

    Type type;

    @Nullable
    FormKind form;

    @Nullable
    ModeType mode;

    public static Transition none() {
        return NONE;
    }

    public static Transition closeForm() {
        return CLOSE_FORM;
    }

    public static Transition openForm(FormKind form) {
        return new Transition(Type.OPEN_FORM, form, null);
    }

    public static Transition back() {
        return BACK;
    }

    public static Transition closeMode() {
        return CLOSE_MODE;
    }

    public static Transition addMode(ModeType mode) {
        return new Transition(Type.ADD_MODE, null, mode);
    }

    public static Transition endSimulation() {
        return END_SIMULATION;
    }

    public boolean isNone() {
        return type == Type.NONE;
    }
}
