package com.oregontrail.mode;

import com.oregontrail.core.GameSimulation;
import lombok.Getter;

/**
 * Base implementation of {@link Form} holding the simulation context.
 */
public abstract class AbstractForm implements Form {

    @Getter
    private final FormKind kind;

    protected final GameSimulation simulation;

    protected AbstractForm(FormKind kind, GameSimulation simulation) {
        this.kind = kind;
        this.simulation = simulation;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + kind + "]";
    }
}
