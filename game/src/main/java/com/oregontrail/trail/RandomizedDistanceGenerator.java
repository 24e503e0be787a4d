package com.oregontrail.trail;

import com.oregontrail.util.Randomization;

/**
 * Splits the remaining trail budget evenly over the remaining legs and adds gaussian
 * jitter, so legs vary while the total never exceeds the trail length.
 */
public class RandomizedDistanceGenerator implements DistanceGenerator {

    /**
     * Standard deviation as a fraction of the even split.
     */
    private static final double SPREAD = 0.25;

    private final Randomization randomization;

    public RandomizedDistanceGenerator(Randomization randomization) {
        this.randomization = randomization;
    }

    @Override
    public int generate(int remainingBudget, int remainingLegs) {
        if (remainingBudget <= 1) {
            return 1;
        }
        int legs = Math.max(1, remainingLegs);
        double evenSplit = (double) remainingBudget / legs;
        // Leave at least one mile for every leg after this one.
        int max = Math.max(1, remainingBudget - (legs - 1));
        return randomization.gaussianRandomInt(evenSplit, evenSplit * SPREAD, 1, max);
    }
}
