package com.oregontrail.event;

import com.oregontrail.util.Randomization;
import lombok.Getter;

/**
 * Base class for events with a fixed roll chance.
 */
public abstract class AbstractRandomEvent implements RandomEvent {

    @Getter
    private final String name;

    @Getter
    private final EventCategory category;

    @Getter
    private final double rollChance;

    @Getter
    private int rollCount;

    protected AbstractRandomEvent(String name, EventCategory category, double rollChance) {
        if (rollChance < 0.0 || rollChance > 1.0) {
            throw new IllegalArgumentException("Roll chance must be within [0, 1]: " + rollChance);
        }
        this.name = name;
        this.category = category;
        this.rollChance = rollChance;
    }

    @Override
    public boolean roll(Randomization randomization) {
        rollCount++;
        return randomization.chance(rollChance);
    }

    @Override
    public String toString() {
        return String.format("%s[%s, chance=%.3f, rolls=%d]", name, category, rollChance, rollCount);
    }
}
