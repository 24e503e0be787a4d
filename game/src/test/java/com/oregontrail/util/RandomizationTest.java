package com.oregontrail.util;

import org.junit.Before;
import org.junit.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.*;

/**
 * Unit tests for Randomization utility class.
 */
public class RandomizationTest {

    private static final int SAMPLE_SIZE = 1000;
    private static final double TOLERANCE = 0.15; // 15% tolerance for statistical tests

    private Randomization randomization;

    @Before
    public void setUp() {
        // Use seeded randomization for reproducible tests
        randomization = new Randomization(12345L);
    }

    // ========================================================================
    // Gaussian Distribution Tests
    // ========================================================================

    @Test
    public void testGaussianRandomInt_CentredOnMean() {
        double mean = 100.0;
        double sum = 0;
        for (int i = 0; i < SAMPLE_SIZE; i++) {
            sum += randomization.gaussianRandomInt(mean, 15.0, 0, 200);
        }

        assertEquals("Mean should be close to specified value", mean, sum / SAMPLE_SIZE, mean * TOLERANCE);
    }

    @Test
    public void testGaussianRandomInt_ZeroSpread_ReturnsRoundedMean() {
        assertEquals(42, randomization.gaussianRandomInt(41.6, 0.0, 0, 100));
        assertEquals(10, randomization.gaussianRandomInt(41.6, 0.0, 0, 10));
    }

    @Test
    public void testGaussianRandomInt_Bounded() {
        for (int i = 0; i < SAMPLE_SIZE; i++) {
            int value = randomization.gaussianRandomInt(100.0, 50.0, 60, 140);
            assertTrue("Value should be >= min", value >= 60);
            assertTrue("Value should be <= max", value <= 140);
        }
    }

    @Test
    public void testSeeded_SameSeedSameSequence() {
        Randomization other = new Randomization(12345L);

        for (int i = 0; i < 20; i++) {
            assertEquals(randomization.uniformRandomInt(0, 1000), other.uniformRandomInt(0, 1000));
        }
    }

    // ========================================================================
    // Uniform Distribution Tests
    // ========================================================================

    @Test
    public void testUniformRandomInt_Range() {
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < SAMPLE_SIZE; i++) {
            int value = randomization.uniformRandomInt(10, 15);
            assertTrue("Value should be in range", value >= 10 && value <= 15);
            seen.add(value);
        }

        assertEquals("Both bounds are inclusive", 6, seen.size());
    }

    @Test
    public void testUniformRandomInt_EmptyRange_ReturnsMin() {
        assertEquals(7, randomization.uniformRandomInt(7, 7));
        assertEquals(7, randomization.uniformRandomInt(7, 3));
    }

    // ========================================================================
    // Probability Tests
    // ========================================================================

    @Test
    public void testChance_Distribution() {
        double probability = 0.3;
        int hits = 0;
        for (int i = 0; i < SAMPLE_SIZE; i++) {
            if (randomization.chance(probability)) {
                hits++;
            }
        }

        assertEquals(probability, (double) hits / SAMPLE_SIZE, probability * TOLERANCE);
    }

    @Test
    public void testChance_Extremes() {
        for (int i = 0; i < 100; i++) {
            assertFalse(randomization.chance(0.0));
            assertTrue(randomization.chance(1.0));
        }
    }
}
