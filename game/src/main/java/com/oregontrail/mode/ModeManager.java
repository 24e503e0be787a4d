package com.oregontrail.mode;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * Stack of active game modes and the dispatcher for {@link Transition} commands.
 *
 * <p>Only the mode on top of the stack renders and receives input. Modes and forms
 * describe what should happen next; this class is the only place the stack changes.
 */
@Slf4j
@Singleton
public class ModeManager implements ModeStack {

    // ========================================================================
    // Configuration
    // ========================================================================

    /**
     * Upper bound on nested modes. Hitting it means a mode keeps pushing itself.
     */
    static final int MAX_STACK_DEPTH = 32;

    // ========================================================================
    // Dependencies
    // ========================================================================

    private final ModeFactory modeFactory;

    private final FormFactory formFactory;

    // ========================================================================
    // State
    // ========================================================================

    private final Deque<GameMode> stack = new ArrayDeque<>();

    /**
     * How many times each mode type has been pushed.
     */
    private final Map<ModeType, Integer> runCount = new EnumMap<>(ModeType.class);

    /**
     * Set once an {@link Transition.Type#END_SIMULATION} transition has been applied.
     */
    @Getter
    private boolean exitRequested;

    @Inject
    public ModeManager(ModeFactory modeFactory, FormFactory formFactory) {
        this.modeFactory = modeFactory;
        this.formFactory = formFactory;
    }

    // ========================================================================
    // Stack
    // ========================================================================

    @Override
    public void addMode(ModeType type) {
        if (stack.size() >= MAX_STACK_DEPTH) {
            throw new IllegalStateException("Mode stack overflow while adding " + type
                    + " (depth " + stack.size() + ")");
        }
        GameMode mode = modeFactory.create(type);
        stack.push(mode);
        runCount.merge(type, 1, Integer::sum);
        log.info("Mode pushed: {} (depth {})", type, stack.size());
    }

    /**
     * Pop the mode on top of the stack.
     *
     * @return the removed mode, or null if the stack was empty
     */
    @Nullable
    public GameMode removeActiveMode() {
        GameMode removed = stack.poll();
        if (removed != null) {
            log.info("Mode removed: {} (depth {})", removed.getType(), stack.size());
        }
        return removed;
    }

    @Nullable
    public GameMode getActiveMode() {
        return stack.peek();
    }

    public boolean isActiveMode(ModeType type) {
        GameMode active = stack.peek();
        return active != null && active.getType() == type;
    }

    public int getRunCount(ModeType type) {
        return runCount.getOrDefault(type, 0);
    }

    public int getStackDepth() {
        return stack.size();
    }

    // ========================================================================
    // Forms
    // ========================================================================

    /**
     * Attach a new form to the active mode, replacing any form already attached.
     *
     * @param kind the form to create
     * @throws IllegalStateException if no mode is active
     */
    public void openForm(FormKind kind) {
        GameMode active = requireActiveMode();
        active.attachForm(formFactory.create(kind));
    }

    public void closeForm() {
        GameMode active = stack.peek();
        if (active != null) {
            active.clearForm();
        }
    }

    // ========================================================================
    // Dispatch
    // ========================================================================

    /**
     * Apply a transition returned by a mode or form.
     *
     * @param transition the command
     */
    public void apply(Transition transition) {
        switch (transition.getType()) {
            case NONE:
                break;
            case CLOSE_FORM:
                closeForm();
                break;
            case OPEN_FORM:
                openForm(transition.getForm());
                break;
            case BACK:
                back();
                break;
            case CLOSE_MODE:
                removeActiveMode();
                break;
            case ADD_MODE:
                addMode(transition.getMode());
                break;
            case END_SIMULATION:
                log.info("End of simulation requested");
                exitRequested = true;
                break;
            default:
                throw new IllegalArgumentException("Unknown transition: " + transition);
        }
    }

    /**
     * Text of the active mode or its form.
     *
     * @return the screen, empty when no mode is active
     */
    public String render() {
        GameMode active = stack.peek();
        return active == null ? "" : active.render();
    }

    /**
     * Route a line of input to the active mode and apply the result.
     *
     * @param input the raw input line
     * @return the transition that was applied
     */
    public Transition sendInput(String input) {
        GameMode active = stack.peek();
        if (active == null) {
            log.debug("Input '{}' dropped, no active mode", input);
            return Transition.none();
        }
        Transition transition = active.sendInput(input);
        if (transition.isNone()) {
            log.debug("Input '{}' ignored by {}", input, active);
        }
        apply(transition);
        return transition;
    }

    /**
     * Drop every mode and reset counters.
     */
    public void clear() {
        stack.clear();
        runCount.clear();
        exitRequested = false;
    }

    private void back() {
        GameMode active = requireActiveMode();
        FormKind previous = active.getPreviousFormKind();
        active.clearForm();
        if (previous != null) {
            openForm(previous);
        }
    }

    private GameMode requireActiveMode() {
        GameMode active = stack.peek();
        if (active == null) {
            throw new IllegalStateException("No active mode");
        }
        return active;
    }
}
