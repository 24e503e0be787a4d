package com.oregontrail.trail;

/**
 * Policy producing the length of the leg between two consecutive locations.
 *
 * <p>Implementations must return a positive distance no larger than
 * {@code remainingBudget}, except that the result is never below 1.
 */
@FunctionalInterface
public interface DistanceGenerator {

    /**
     * Produce the next leg distance.
     *
     * @param remainingBudget trail length not yet allotted to earlier legs
     * @param remainingLegs   legs still to travel including this one, at least 1
     * @return the leg distance in miles, at least 1
     */
    int generate(int remainingBudget, int remainingLegs);
}
