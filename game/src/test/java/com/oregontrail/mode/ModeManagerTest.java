package com.oregontrail.mode;

import com.oregontrail.core.GameSimulation;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ModeManager.
 * Uses stub modes and forms so only the stack and dispatch logic is exercised.
 */
public class ModeManagerTest {

    @Mock
    private ModeFactory modeFactory;

    @Mock
    private FormFactory formFactory;

    @Mock
    private GameSimulation simulation;

    private ModeManager manager;

    @Before
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        when(modeFactory.create(any(ModeType.class)))
                .thenAnswer(invocation -> new StubMode(invocation.getArgument(0), simulation));
        when(formFactory.create(any(FormKind.class)))
                .thenAnswer(invocation -> new StubForm(invocation.getArgument(0)));
        manager = new ModeManager(modeFactory, formFactory);
    }

    // ========================================================================
    // Stack
    // ========================================================================

    @Test
    public void testAddMode_PushesAndCounts() {
        manager.addMode(ModeType.TRAVEL);
        manager.addMode(ModeType.LANDMARK);
        manager.removeActiveMode();
        manager.addMode(ModeType.LANDMARK);

        assertTrue(manager.isActiveMode(ModeType.LANDMARK));
        assertEquals(2, manager.getStackDepth());
        assertEquals(1, manager.getRunCount(ModeType.TRAVEL));
        assertEquals(2, manager.getRunCount(ModeType.LANDMARK));
        assertEquals(0, manager.getRunCount(ModeType.END_GAME));
    }

    @Test
    public void testRemoveActiveMode_EmptyStack_ReturnsNull() {
        assertNull(manager.removeActiveMode());
        assertNull(manager.getActiveMode());
    }

    @Test
    public void testAddMode_TooDeep_Throws() {
        for (int i = 0; i < ModeManager.MAX_STACK_DEPTH; i++) {
            manager.addMode(ModeType.LANDMARK);
        }
        try {
            manager.addMode(ModeType.LANDMARK);
            fail("Expected overflow");
        } catch (IllegalStateException e) {
            assertEquals(ModeManager.MAX_STACK_DEPTH, manager.getStackDepth());
        }
    }

    // ========================================================================
    // Dispatch
    // ========================================================================

    @Test
    public void testApply_OpenForm_AttachesAndRunsPostCreate() {
        manager.addMode(ModeType.TRAVEL);

        manager.apply(Transition.openForm(FormKind.CHECK_SUPPLIES));

        GameMode active = manager.getActiveMode();
        assertTrue(active.hasForm());
        assertTrue(((StubForm) active.getCurrentForm()).created);
        assertEquals("form:CHECK_SUPPLIES", manager.render());
    }

    @Test
    public void testSendInput_FormCloses_BackToModeScreen() {
        manager.addMode(ModeType.TRAVEL);
        manager.openForm(FormKind.CHECK_SUPPLIES);

        Transition transition = manager.sendInput("close");

        assertEquals(Transition.Type.CLOSE_FORM, transition.getType());
        assertFalse(manager.getActiveMode().hasForm());
        assertEquals("mode:TRAVEL", manager.render());
    }

    @Test
    public void testApply_Back_ReopensPreviousForm() {
        manager.addMode(ModeType.TRAVEL);
        manager.openForm(FormKind.LOCATION_FORK);
        manager.openForm(FormKind.LOOK_AT_MAP);

        manager.sendInput("back");

        assertEquals(FormKind.LOCATION_FORK, manager.getActiveMode().getCurrentForm().getKind());
        verify(formFactory, times(2)).create(FormKind.LOCATION_FORK);
    }

    @Test
    public void testApply_BackWithoutPrevious_ClosesForm() {
        manager.addMode(ModeType.TRAVEL);
        manager.openForm(FormKind.LOOK_AT_MAP);

        manager.sendInput("back");

        assertFalse(manager.getActiveMode().hasForm());
    }

    @Test
    public void testSendInput_ModeCloses_Pops() {
        manager.addMode(ModeType.TRAVEL);
        manager.addMode(ModeType.SETTLEMENT);

        manager.sendInput("anything");

        assertTrue(manager.isActiveMode(ModeType.TRAVEL));
    }

    @Test
    public void testSendInput_Ignored_NothingChanges() {
        manager.addMode(ModeType.TRAVEL);
        manager.openForm(FormKind.CHECK_SUPPLIES);

        Transition transition = manager.sendInput("noise");

        assertTrue(transition.isNone());
        assertTrue(manager.getActiveMode().hasForm());
    }

    @Test
    public void testApply_AddModeAndEnd() {
        manager.addMode(ModeType.TRAVEL);

        manager.apply(Transition.addMode(ModeType.END_GAME));
        manager.apply(Transition.endSimulation());

        assertTrue(manager.isActiveMode(ModeType.END_GAME));
        assertTrue(manager.isExitRequested());
    }

    @Test
    public void testEmptyStack_RenderAndInputAreSafe() {
        assertEquals("", manager.render());
        assertTrue(manager.sendInput("1").isNone());
    }

    @Test(expected = IllegalStateException.class)
    public void testOpenForm_NoActiveMode_Throws() {
        manager.openForm(FormKind.CHECK_SUPPLIES);
    }

    @Test
    public void testClear_ResetsEverything() {
        manager.addMode(ModeType.TRAVEL);
        manager.apply(Transition.endSimulation());

        manager.clear();

        assertEquals(0, manager.getStackDepth());
        assertEquals(0, manager.getRunCount(ModeType.TRAVEL));
        assertFalse(manager.isExitRequested());
    }

    // ========================================================================
    // Stubs
    // ========================================================================

    /**
     * Travel stub ignores input, every other stub mode closes on input.
     */
    private static class StubMode extends GameMode {

        StubMode(ModeType type, GameSimulation simulation) {
            super(type, simulation);
        }

        @Override
        protected String onRenderMode() {
            return "mode:" + getType();
        }

        @Override
        protected Transition onModeInput(DialogResponse response) {
            return getType() == ModeType.TRAVEL ? Transition.none() : Transition.closeMode();
        }
    }

    private static class StubForm implements Form {

        private final FormKind kind;
        private boolean created;

        StubForm(FormKind kind) {
            this.kind = kind;
        }

        @Override
        public FormKind getKind() {
            return kind;
        }

        @Override
        public void onFormPostCreate() {
            created = true;
        }

        @Override
        public String render() {
            return "form:" + kind;
        }

        @Override
        public Transition onInputBufferReturned(String input) {
            switch (input) {
                case "close":
                    return Transition.closeForm();
                case "back":
                    return Transition.back();
                default:
                    return Transition.none();
            }
        }
    }
}
