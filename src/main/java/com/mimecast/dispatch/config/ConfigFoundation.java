package com.mimecast.dispatch.config;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Map backed configuration container with type safe accessors.
 * <p>Configuration files are JSON5 and are read with a lenient Gson reader.
 * <br>Comments, single quotes, unquoted keys and trailing commas are tolerated.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration map.
     * <p>The map is copied and the copy is never mutated.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map != null ? Collections.unmodifiableMap(new HashMap<>(map)) : Collections.emptyMap();
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ConfigFoundation(String path) throws IOException {
        this(readFile(path));
    }

    /**
     * Reads a JSON5 file into a map.
     *
     * @param path Path to configuration file.
     * @return Map instance.
     * @throws IOException Unable to read file.
     */
    public static Map<String, Object> readFile(String path) throws IOException {
        String json5 = Files.readString(Paths.get(path), StandardCharsets.UTF_8);
        return parse(json5);
    }

    /**
     * Parses a JSON5 string into a map.
     *
     * @param json5 JSON5 string.
     * @return Map instance.
     * @throws IOException Unable to parse.
     */
    public static Map<String, Object> parse(String json5) throws IOException {
        try (Reader reader = new StringReader(json5)) {
            JsonReader jsonReader = new JsonReader(reader);
            jsonReader.setLenient(true);
            Map<String, Object> parsed = new Gson().fromJson(jsonReader, new TypeToken<Map<String, Object>>() {}.getType());
            return parsed != null ? parsed : new HashMap<>();
        } catch (RuntimeException e) {
            throw new IOException("Unable to parse configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Gets configuration map.
     *
     * @return Map instance.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Has property.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.get(name) != null;
    }

    /**
     * Gets property as String.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets property as String with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = map.get(name);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets property as Long.
     *
     * @param name Property name.
     * @return Long or null.
     */
    public Long getLongProperty(String name) {
        Object value = map.get(name);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String string && !string.isBlank()) {
            try {
                return (long) Double.parseDouble(string.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Property " + name + " is not a number: " + string, e);
            }
        }
        return null;
    }

    /**
     * Gets property as Long with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        Long value = getLongProperty(name);
        return value != null ? value : defaultValue;
    }

    /**
     * Gets property as Double with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Double.
     */
    public Double getDoubleProperty(String name, Double defaultValue) {
        Object value = map.get(name);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String string && !string.isBlank()) {
            try {
                return Double.parseDouble(string.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Property " + name + " is not a number: " + string, e);
            }
        }
        return defaultValue;
    }

    /**
     * Gets property as Boolean.
     *
     * @param name Property name.
     * @return Boolean, false if absent.
     */
    public boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets property as Boolean with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean defaultValue) {
        Object value = map.get(name);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String string) {
            return Boolean.parseBoolean(string.trim());
        }
        return defaultValue;
    }

    /**
     * Gets property as Map.
     *
     * @param name Property name.
     * @return Map, empty if absent.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = map.get(name);
        return value instanceof Map ? (Map<String, Object>) value : new HashMap<>();
    }

    /**
     * Gets property as List.
     *
     * @param name Property name.
     * @return List, empty if absent.
     */
    public <T> List<T> getListProperty(String name) {
        Object value = map.get(name);
        return value instanceof List ? (List<T>) value : new ArrayList<>();
    }
}
