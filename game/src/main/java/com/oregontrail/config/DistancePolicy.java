package com.oregontrail.config;

/**
 * How the distance between two consecutive locations is produced.
 */
public enum DistancePolicy {

    /**
     * Every leg has the same configured length, capped by the remaining trail budget.
     */
    FIXED,

    /**
     * Gaussian jitter around an even split of the remaining trail budget.
     */
    RANDOMIZED
}
