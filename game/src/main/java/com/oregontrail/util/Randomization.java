package com.oregontrail.util;

import javax.inject.Singleton;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Dice for the simulation: leg lengths come from {@link #gaussianRandomInt}, event
 * rolls from {@link #chance} and event amounts from {@link #uniformRandomInt}.
 * A seeded instance replays the same game.
 */
@Singleton
public class Randomization {

    private final Random random;

    public Randomization() {
        this.random = ThreadLocalRandom.current();
    }

    public Randomization(long seed) {
        this.random = new Random(seed);
    }

    /**
     * Draw from a normal distribution and round it into {@code [min, max]}.
     *
     * @param mean   centre of the distribution
     * @param stdDev spread of the distribution
     * @param min    smallest result
     * @param max    largest result
     * @return the rounded, clamped draw
     */
    public int gaussianRandomInt(double mean, double stdDev, int min, int max) {
        double draw = mean + random.nextGaussian() * stdDev;
        return (int) Math.round(Math.max(min, Math.min(max, draw)));
    }

    /**
     * @return an integer in {@code [min, max]}, both inclusive; {@code min} when the range is empty
     */
    public int uniformRandomInt(int min, int max) {
        if (min >= max) {
            return min;
        }
        return min + random.nextInt(max - min + 1);
    }

    /**
     * Roll against a probability between 0 and 1.
     */
    public boolean chance(double probability) {
        return random.nextDouble() < probability;
    }
}
