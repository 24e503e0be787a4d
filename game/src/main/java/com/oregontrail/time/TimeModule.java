package com.oregontrail.time;

import com.oregontrail.core.SimulationModule;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Game calendar. Each fixed tick is one day and one turn.
 */
@Slf4j
public class TimeModule implements SimulationModule {

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.US);

    private final LocalDate startDate;

    @Getter
    private LocalDate date;

    /**
     * Number of fixed ticks processed since the game started.
     */
    @Getter
    private int totalTurns;

    public TimeModule(LocalDate startDate) {
        this.startDate = startDate;
        this.date = startDate;
        this.totalTurns = 0;
    }

    @Override
    public void onTick(boolean systemTick) {
        if (systemTick) {
            return;
        }
        date = date.plusDays(1);
        totalTurns++;
        log.debug("Day {} begins: {}", totalTurns, date);
    }

    /**
     * Lose days without advancing the trail, e.g. waiting out a repair.
     *
     * @param days days to skip, ignored when not positive
     */
    public void skipDays(int days) {
        if (days > 0) {
            date = date.plusDays(days);
        }
    }

    /**
     * Date as shown to the player, e.g. "March 1, 1848".
     *
     * @return the formatted date
     */
    public String getFormattedDate() {
        return formatDate(date);
    }

    public static String formatDate(LocalDate date) {
        return DISPLAY_FORMAT.format(date);
    }

    @Override
    public void destroy() {
        date = startDate;
        totalTurns = 0;
    }
}
