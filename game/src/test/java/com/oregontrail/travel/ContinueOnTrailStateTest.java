package com.oregontrail.travel;

import com.oregontrail.config.GameConfig;
import com.oregontrail.core.GameSimulation;
import com.oregontrail.core.SimulationFixture;
import com.oregontrail.mode.DialogState;
import com.oregontrail.mode.Transition;
import com.oregontrail.trail.FixedDistanceGenerator;
import com.oregontrail.trail.LocationStatus;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ContinueOnTrailStateTest {

    private GameSimulation simulation;
    private ContinueOnTrailState state;

    @Before
    public void setUp() {
        simulation = SimulationFixture.create(SimulationFixture.forkTrail(),
                GameConfig.builder().baseMileage(10).build(), new FixedDistanceGenerator(30));
        simulation.start();
        state = new ContinueOnTrailState(simulation);
    }

    @Test
    public void testRender_ShowsLegToNextLocation() {
        assertEquals("\nFrom Start Town it is 30\nmiles to the Split Rock\n\n" + DialogState.CONTINUE_FOOTER,
                state.render());
    }

    @Test
    public void testRender_CalledTwice_SameText() {
        assertEquals(state.render(), state.render());
    }

    @Test
    public void testRender_LastLocation_FallsBackToEndOfTrail() {
        simulation.getTrail().departCurrentLocation();
        simulation.getModes().removeActiveMode();
        for (int i = 0; i < 10 && !simulation.getTrail().reachedNextPoint(); i++) {
            simulation.tick(false);
        }
        simulation.getTrail().departCurrentLocation();
        for (int i = 0; i < 10 && !simulation.getTrail().reachedNextPoint(); i++) {
            simulation.tick(false);
        }

        assertEquals("Journey's End", simulation.getTrail().getCurrentLocation().getName());
        assertTrue(state.render().contains("miles to the end of the trail"));
    }

    @Test
    public void testOnInput_AnyResponse_DepartsAndCloses() {
        Transition transition = state.onInputBufferReturned("");

        assertEquals(Transition.Type.CLOSE_FORM, transition.getType());
        assertEquals(LocationStatus.DEPARTED, simulation.getTrail().getCurrentLocation().getStatus());
        assertEquals(30, simulation.getTrail().getDistanceToNextLocation());
        assertTrue(simulation.isVehicleMoving());
    }
}
