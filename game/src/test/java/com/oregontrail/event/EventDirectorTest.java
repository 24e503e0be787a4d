package com.oregontrail.event;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.time.TimeModule;
import com.oregontrail.util.Randomization;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

public class EventDirectorTest {

    @Mock
    private GameSimulation simulation;

    private TimeModule time;

    @Before
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        time = new TimeModule(LocalDate.of(1848, 5, 10));
        when(simulation.getTime()).thenReturn(time);
    }

    @Test
    public void testRoll_CertainEvent_RecordsHistory() {
        FixedEvent certain = new FixedEvent("Certain", 1.0);
        EventDirector director = new EventDirector(new Randomization(1L), Collections.singletonList(certain), true);

        Optional<EventHistoryItem> fired = director.roll(simulation);

        assertTrue(fired.isPresent());
        assertEquals(new EventHistoryItem(LocalDate.of(1848, 5, 10), "Certain", EventCategory.WILD), fired.get());
        assertEquals(1, director.getHistory().size());
        assertEquals("Certain happened", director.getLastMessage());
    }

    @Test
    public void testRoll_AtMostOneEventPerTick() {
        FixedEvent first = new FixedEvent("First", 1.0);
        FixedEvent second = new FixedEvent("Second", 1.0);
        EventDirector director = new EventDirector(new Randomization(1L), Arrays.asList(first, second), true);

        director.roll(simulation);

        assertEquals(1, first.getRollCount());
        assertEquals(0, second.getRollCount());
        assertEquals("First", director.getHistory().get(0).getEventName());
    }

    @Test
    public void testRoll_ImpossibleEvent_RolledButNeverFires() {
        FixedEvent never = new FixedEvent("Never", 0.0);
        EventDirector director = new EventDirector(new Randomization(1L), Collections.singletonList(never), true);

        for (int i = 0; i < 10; i++) {
            assertFalse(director.roll(simulation).isPresent());
        }

        assertEquals(10, never.getRollCount());
        assertTrue(director.getHistory().isEmpty());
        assertNull(director.getLastMessage());
    }

    @Test
    public void testRoll_Disabled_NothingRolled() {
        FixedEvent certain = new FixedEvent("Certain", 1.0);
        EventDirector director = new EventDirector(new Randomization(1L), Collections.singletonList(certain), false);

        assertFalse(director.roll(simulation).isPresent());
        assertEquals(0, certain.getRollCount());
    }

    @Test
    public void testDestroy_ClearsHistory() {
        EventDirector director = new EventDirector(new Randomization(1L),
                Collections.singletonList(new FixedEvent("Certain", 1.0)), true);
        director.roll(simulation);

        director.destroy();

        assertTrue(director.getHistory().isEmpty());
        assertNull(director.getLastMessage());
    }

    @Test
    public void testDefaultEvents_ShipsThreeEvents() {
        assertEquals(3, EventDirector.defaultEvents(new Randomization(1L)).size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRollChance_OutOfRange_Throws() {
        new FixedEvent("Broken", 1.5);
    }

    private static class FixedEvent extends AbstractRandomEvent {

        FixedEvent(String name, double chance) {
            super(name, EventCategory.WILD, chance);
        }

        @Override
        public String execute(GameSimulation simulation) {
            return getName() + " happened";
        }
    }
}
