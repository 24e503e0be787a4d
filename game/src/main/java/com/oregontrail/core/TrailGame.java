package com.oregontrail.core;

import com.google.inject.Guice;
import com.google.inject.Injector;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Entry point. Builds the injector and runs the console game.
 */
@Slf4j
public class TrailGame {

    public static void main(String[] args) {
        try {
            Injector injector = Guice.createInjector(new GameInjectorModule());
            ConsoleGame game = injector.getInstance(ConsoleGame.class);
            game.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
        } catch (Exception e) {
            log.error("Game terminated unexpectedly", e);
            System.exit(1);
        }
    }
}
