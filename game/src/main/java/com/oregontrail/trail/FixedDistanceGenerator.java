package com.oregontrail.trail;

import lombok.Getter;

/**
 * Every leg has the same length, capped by the remaining budget.
 */
public class FixedDistanceGenerator implements DistanceGenerator {

    @Getter
    private final int distance;

    public FixedDistanceGenerator(int distance) {
        if (distance <= 0) {
            throw new IllegalArgumentException("Fixed distance must be positive: " + distance);
        }
        this.distance = distance;
    }

    @Override
    public int generate(int remainingBudget, int remainingLegs) {
        return Math.max(1, Math.min(distance, remainingBudget));
    }
}
