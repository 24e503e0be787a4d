package com.oregontrail.event;

import com.oregontrail.core.GameSimulation;
import com.oregontrail.event.impl.BrokenWheelEvent;
import com.oregontrail.event.impl.ThiefEvent;
import com.oregontrail.event.impl.WildFruitEvent;
import com.oregontrail.util.Randomization;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Rolls random events once per day of travel and keeps the history of those that fired.
 *
 * <p>Events are rolled in registration order and at most one fires per day.
 */
@Slf4j
public class EventDirector {

    private final Randomization randomization;

    private final List<RandomEvent> events;

    @Getter
    private final boolean enabled;

    private final List<EventHistoryItem> history = new ArrayList<>();

    /**
     * Message of the most recent event, shown by the random event form.
     */
    @Getter
    @Nullable
    private String lastMessage;

    public EventDirector(Randomization randomization, List<RandomEvent> events, boolean enabled) {
        this.randomization = randomization;
        this.events = new ArrayList<>(events);
        this.enabled = enabled;
    }

    /**
     * The events shipped with the game.
     *
     * @param randomization random source used for event amounts
     * @return a new list of events
     */
    public static List<RandomEvent> defaultEvents(Randomization randomization) {
        return Arrays.asList(
                new BrokenWheelEvent(),
                new ThiefEvent(randomization),
                new WildFruitEvent(randomization));
    }

    /**
     * Roll every event for one day of travel.
     *
     * @param simulation the running game
     * @return the event that fired, if any
     */
    public Optional<EventHistoryItem> roll(GameSimulation simulation) {
        if (!enabled) {
            return Optional.empty();
        }
        for (RandomEvent event : events) {
            if (!event.roll(randomization)) {
                continue;
            }
            lastMessage = event.execute(simulation);
            EventHistoryItem item = new EventHistoryItem(
                    simulation.getTime().getDate(), event.getName(), event.getCategory());
            history.add(item);
            log.info("Random event: {} on {}", event.getName(), item.getTimestamp());
            return Optional.of(item);
        }
        return Optional.empty();
    }

    public List<EventHistoryItem> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public List<RandomEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public void destroy() {
        history.clear();
        lastMessage = null;
    }
}
