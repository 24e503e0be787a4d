package com.oregontrail.trail;

import com.oregontrail.mode.ModeType;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class TrailTest {

    @Test(expected = IllegalArgumentException.class)
    public void testConstructor_NoLocations_Throws() {
        new Trail("Empty", Collections.emptyList(), 100);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testConstructor_NonPositiveLength_Throws() {
        new Trail("Short", Collections.singletonList(new Location("A", ModeType.LANDMARK)), 0);
    }

    @Test
    public void testInsert_KeepsVisitOrder() {
        Location a = new Location("A", ModeType.LANDMARK);
        Location c = new Location("C", ModeType.LANDMARK);
        Trail trail = new Trail("Trail", Arrays.asList(a, c), 100);
        Location b = new Location("B", ModeType.LANDMARK);

        trail.insert(1, b);

        assertEquals(Arrays.asList(a, b, c), trail.getLocations());
        assertEquals(3, trail.size());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testGetLocations_ReadOnly() {
        Trail trail = new Trail("Trail", Collections.singletonList(new Location("A", ModeType.LANDMARK)), 100);
        trail.getLocations().clear();
    }
}
