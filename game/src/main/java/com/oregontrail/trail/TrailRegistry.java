package com.oregontrail.trail;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.oregontrail.data.JsonResourceLoader;
import com.oregontrail.mode.ModeType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Builds {@link Trail} instances from JSON trail definitions on the classpath.
 *
 * <p>Definition format:
 * <pre>{@code
 * {
 *   "name": "Oregon Trail",
 *   "trailLength": 2040,
 *   "locations": [
 *     { "name": "Independence", "mode": "SETTLEMENT" },
 *     { "name": "South Pass", "mode": "LANDMARK",
 *       "skipChoices": [ { "name": "Fort Bridger", "mode": "SETTLEMENT" } ] }
 *   ]
 * }
 * }</pre>
 */
@Slf4j
public final class TrailRegistry {

    private TrailRegistry() {
        // Utility class - prevent instantiation
    }

    /**
     * Load a trail definition.
     *
     * @param gson         Gson instance
     * @param resourcePath classpath resource of the definition
     * @param maxAttempts  load attempts before giving up
     * @return a fresh trail with every location UNVISITED
     * @throws JsonResourceLoader.JsonLoadException if the definition is missing or invalid
     */
    public static Trail load(Gson gson, String resourcePath, int maxAttempts) {
        Trail trail = JsonResourceLoader.loadAndParse(gson, resourcePath, TrailRegistry::parseTrail,
                maxAttempts, JsonResourceLoader.DEFAULT_RETRY_DELAY_MS);
        log.info("Loaded trail '{}' from {} ({} locations, {} miles)",
                trail.getName(), resourcePath, trail.size(), trail.getTrailLength());
        return trail;
    }

    /**
     * Parse a trail definition document.
     *
     * @param json the document
     * @return the trail
     */
    public static Trail parseTrail(JsonObject json) {
        String name = JsonResourceLoader.getRequiredString(json, "name");
        int trailLength = json.has("trailLength") ? json.get("trailLength").getAsInt() : 0;
        JsonArray locationsJson = JsonResourceLoader.getRequiredArray(json, "locations");

        List<Location> locations = new ArrayList<>();
        for (JsonElement element : locationsJson) {
            locations.add(parseLocation(element.getAsJsonObject()));
        }
        return new Trail(name, locations, trailLength);
    }

    private static Location parseLocation(JsonObject json) {
        String name = JsonResourceLoader.getRequiredString(json, "name");
        ModeType mode = ModeType.valueOf(
                JsonResourceLoader.getRequiredString(json, "mode").toUpperCase(Locale.ROOT));

        if (!json.has("skipChoices")) {
            return new Location(name, mode);
        }

        List<Location> skipChoices = new ArrayList<>();
        for (JsonElement element : json.getAsJsonArray("skipChoices")) {
            skipChoices.add(parseLocation(element.getAsJsonObject()));
        }
        return new Location(name, mode, Collections.unmodifiableList(skipChoices));
    }
}
