package com.oregontrail.core;

import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Text console game loop: print the screen, read a line, submit it, then let days pass
 * while the wagon travels uninterrupted.
 */
@Slf4j
public class ConsoleGame {

    /**
     * Days simulated per input before control returns to the player.
     */
    static final int MAX_TICKS_PER_INPUT = 365;

    private final GameSimulation simulation;

    @Inject
    public ConsoleGame(GameSimulation simulation) {
        this.simulation = simulation;
    }

    /**
     * Play until the simulation closes or input runs out.
     *
     * @param in  player input
     * @param out game text output
     * @throws IOException if reading input fails
     */
    public void run(BufferedReader in, PrintStream out) throws IOException {
        simulation.start();
        try {
            while (!simulation.isClosed()) {
                out.println(simulation.render());
                String line = in.readLine();
                if (line == null) {
                    log.info("Input closed, leaving the game");
                    break;
                }
                simulation.submitInput(line);
                travel(out);
            }
        } finally {
            simulation.destroy();
        }
    }

    private void travel(PrintStream out) {
        int ticks = 0;
        while (simulation.isTraveling() && ticks < MAX_TICKS_PER_INPUT) {
            simulation.tick(false);
            ticks++;
        }
        if (ticks >= MAX_TICKS_PER_INPUT) {
            log.warn("Wagon still rolling after {} days, handing control back", ticks);
            out.println(simulation.render());
        }
    }
}
