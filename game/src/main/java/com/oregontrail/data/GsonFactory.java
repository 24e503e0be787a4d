package com.oregontrail.data;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.time.LocalDate;

/**
 * Centralized factory for creating Gson instances with proper TypeAdapters.
 *
 * <p>Game dates are written as ISO-8601 strings instead of going through
 * reflection, which the module system blocks for {@code java.time} internals.
 *
 * <p>Usage:
 * <pre>
 * Gson gson = GsonFactory.create();
 * LocalDate start = gson.fromJson("\"1848-03-01\"", LocalDate.class);
 * </pre>
 */
public final class GsonFactory {

    private GsonFactory() {
        // Utility class - prevent instantiation
    }

    /**
     * Create a Gson instance with the game TypeAdapters registered.
     *
     * @return configured Gson instance
     */
    public static Gson create() {
        return builder().create();
    }

    /**
     * Get a GsonBuilder pre-configured with the game TypeAdapters.
     *
     * @return pre-configured GsonBuilder
     */
    public static GsonBuilder builder() {
        return new GsonBuilder()
                .registerTypeAdapter(LocalDate.class, new LocalDateAdapter());
    }

    /**
     * TypeAdapter for {@link LocalDate} using ISO-8601 format.
     * Example: "1848-03-01"
     */
    private static class LocalDateAdapter extends TypeAdapter<LocalDate> {
        @Override
        public void write(JsonWriter out, LocalDate value) throws IOException {
            if (value == null) {
                out.nullValue();
            } else {
                out.value(value.toString());
            }
        }

        @Override
        public LocalDate read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            return LocalDate.parse(in.nextString());
        }
    }
}
