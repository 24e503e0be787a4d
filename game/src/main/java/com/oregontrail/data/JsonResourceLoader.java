package com.oregontrail.data;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/**
 * Reads the game's JSON documents (configuration and trail definitions) from the classpath.
 *
 * <p>Every failure, whether the resource is absent, unreadable, syntactically broken or
 * rejected by the caller's parser, surfaces as a {@link JsonLoadException} naming the
 * resource path.
 */
@Slf4j
public final class JsonResourceLoader {

    /** Pause between attempts when a trail definition cannot be read. */
    public static final long DEFAULT_RETRY_DELAY_MS = 250;

    private JsonResourceLoader() {
        // Utility class - prevent instantiation
    }

    /**
     * Read a document, retrying up to {@code maxAttempts} times.
     *
     * @param gson         parser
     * @param resourcePath classpath path, e.g. {@code /trails/oregon_trail.json}
     * @param maxAttempts  attempts before giving up
     * @param retryDelayMs pause between attempts
     * @return the document root
     * @throws JsonLoadException once every attempt has failed
     */
    public static JsonObject load(Gson gson, String resourcePath, int maxAttempts, long retryDelayMs) {
        JsonLoadException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return read(gson, resourcePath);
            } catch (JsonLoadException e) {
                lastFailure = e;
                log.warn("Reading {} failed (attempt {}/{}): {}",
                        resourcePath, attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts) {
                pause(resourcePath, retryDelayMs);
            }
        }

        throw new JsonLoadException(
                "Gave up on " + resourcePath + " after " + maxAttempts + " attempts", lastFailure);
    }

    /**
     * Read a document and hand it to {@code parser}. Anything the parser throws is
     * reported against the resource; a {@link JsonLoadException} from the parser is
     * passed through as is.
     */
    public static <T> T loadAndParse(Gson gson, String resourcePath, Function<JsonObject, T> parser,
                                     int maxAttempts, long retryDelayMs) {
        JsonObject json = load(gson, resourcePath, maxAttempts, retryDelayMs);
        try {
            return parser.apply(json);
        } catch (JsonLoadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new JsonLoadException("Cannot use " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Read a document that may legitimately be absent.
     *
     * @return the document root, or null when no such resource is on the classpath
     * @throws JsonLoadException if the resource exists but cannot be read or parsed
     */
    @Nullable
    public static JsonObject loadOptional(Gson gson, String resourcePath) {
        if (JsonResourceLoader.class.getResource(resourcePath) == null) {
            log.debug("Optional resource {} is not on the classpath", resourcePath);
            return null;
        }
        return read(gson, resourcePath);
    }

    /**
     * @throws JsonLoadException if {@code fieldName} is not an array of {@code root}
     */
    public static JsonArray getRequiredArray(JsonObject root, String fieldName) {
        JsonElement element = root.get(fieldName);
        if (element == null || !element.isJsonArray()) {
            throw new JsonLoadException("Required array '" + fieldName + "' not found in JSON");
        }
        return element.getAsJsonArray();
    }

    /**
     * @throws JsonLoadException if {@code fieldName} is missing or null
     */
    public static String getRequiredString(JsonObject root, String fieldName) {
        JsonElement element = root.get(fieldName);
        if (element == null || element.isJsonNull()) {
            throw new JsonLoadException("Required field '" + fieldName + "' not found in JSON");
        }
        return element.getAsString();
    }

    private static JsonObject read(Gson gson, String resourcePath) {
        try (InputStream is = JsonResourceLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new JsonLoadException("Resource not found: " + resourcePath);
            }
            JsonObject root = gson.fromJson(new InputStreamReader(is, StandardCharsets.UTF_8), JsonObject.class);
            if (root == null) {
                throw new JsonLoadException("Empty document: " + resourcePath);
            }
            return root;
        } catch (JsonParseException e) {
            throw new JsonLoadException("Invalid JSON in " + resourcePath, e);
        } catch (IOException e) {
            throw new JsonLoadException("I/O error reading " + resourcePath, e);
        }
    }

    private static void pause(String resourcePath, long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JsonLoadException("Interrupted while loading " + resourcePath, e);
        }
    }

    /**
     * A JSON resource could not be turned into game data.
     */
    public static class JsonLoadException extends RuntimeException {
        public JsonLoadException(String message) {
            super(message);
        }

        public JsonLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
