package com.oregontrail.config;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.oregontrail.data.JsonResourceLoader;
import com.oregontrail.vehicle.SimulationEntity;
import com.oregontrail.vehicle.TravelPace;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads {@link GameConfig} from a classpath JSON resource.
 *
 * <p>Keys missing from the document keep their {@link GameConfig} default. A missing
 * resource yields {@link GameConfig#DEFAULTS}; a malformed document or value fails the load.
 */
@Slf4j
public final class GameConfigLoader {

    public static final String DEFAULT_RESOURCE = "/config/game.json";

    private GameConfigLoader() {
        // Utility class - prevent instantiation
    }

    /**
     * Load the configuration, falling back to defaults if the resource is absent.
     *
     * @param gson         Gson instance from {@link com.oregontrail.data.GsonFactory}
     * @param resourcePath classpath resource
     * @return the configuration
     * @throws JsonResourceLoader.JsonLoadException if the document is not valid JSON or a value cannot be parsed
     */
    public static GameConfig load(Gson gson, String resourcePath) {
        JsonObject json = JsonResourceLoader.loadOptional(gson, resourcePath);
        if (json == null) {
            log.info("No configuration at {}, using defaults", resourcePath);
            return GameConfig.DEFAULTS;
        }
        try {
            GameConfig config = parse(gson, json);
            log.info("Loaded configuration from {}", resourcePath);
            return config;
        } catch (RuntimeException e) {
            throw new JsonResourceLoader.JsonLoadException(
                    "Invalid configuration in " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parse a configuration document.
     *
     * @param gson Gson instance used for typed values
     * @param json the document
     * @return the configuration
     */
    public static GameConfig parse(Gson gson, JsonObject json) {
        GameConfig.GameConfigBuilder builder = GameConfig.DEFAULTS.toBuilder();

        if (json.has("trailResource")) {
            builder.trailResource(json.get("trailResource").getAsString());
        }
        if (json.has("startDate")) {
            builder.startDate(gson.fromJson(json.get("startDate"), LocalDate.class));
        }
        if (json.has("baseMileage")) {
            builder.baseMileage(requireNonNegative("baseMileage", json.get("baseMileage").getAsInt()));
        }
        if (json.has("pace")) {
            builder.pace(TravelPace.valueOf(upper(json.get("pace"))));
        }
        if (json.has("distancePolicy")) {
            builder.distancePolicy(DistancePolicy.valueOf(upper(json.get("distancePolicy"))));
        }
        if (json.has("fixedDistance")) {
            int fixedDistance = json.get("fixedDistance").getAsInt();
            if (fixedDistance <= 0) {
                throw new IllegalArgumentException("fixedDistance must be positive: " + fixedDistance);
            }
            builder.fixedDistance(fixedDistance);
        }
        if (json.has("randomSeed")) {
            builder.randomSeed(json.get("randomSeed").getAsLong());
        }
        if (json.has("randomEventsEnabled")) {
            builder.randomEventsEnabled(json.get("randomEventsEnabled").getAsBoolean());
        }
        if (json.has("loadAttempts")) {
            builder.loadAttempts(Math.max(1, json.get("loadAttempts").getAsInt()));
        }
        if (json.has("startingInventory")) {
            builder.startingInventory(parseInventory(json.getAsJsonObject("startingInventory")));
        }

        return builder.build();
    }

    private static Map<SimulationEntity, Double> parseInventory(JsonObject json) {
        Map<SimulationEntity, Double> inventory = new EnumMap<>(GameConfig.DEFAULTS.getStartingInventory());
        for (Map.Entry<String, JsonElement> entry : json.entrySet()) {
            SimulationEntity entity = SimulationEntity.valueOf(entry.getKey().toUpperCase(Locale.ROOT));
            inventory.put(entity, entry.getValue().getAsDouble());
        }
        return Collections.unmodifiableMap(inventory);
    }

    private static String upper(JsonElement element) {
        return element.getAsString().toUpperCase(Locale.ROOT);
    }

    private static int requireNonNegative(String key, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(key + " must not be negative: " + value);
        }
        return value;
    }
}
