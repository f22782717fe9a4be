package com.onechance.courier.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration file foundation.
 *
 * <p>Reads JSON5 configuration files into a map.
 * <p>Gson reads in lenient mode which accepts comments, unquoted keys and single quoted strings.
 */
public class ConfigFoundation extends BasicConfig {

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
        super();
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ConfigFoundation instance with file path.
     *
     * @param path File path.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        super(readFile(path));
    }

    /**
     * Reads a JSON5 file into a map.
     *
     * @param path File path.
     * @return Map of String, Object.
     * @throws IOException Unable to read or parse file.
     */
    public static Map<String, Object> readFile(String path) throws IOException {
        String content = Files.readString(Path.of(path), StandardCharsets.UTF_8);
        try {
            return parse(new StringReader(content));
        } catch (JsonParseException e) {
            throw new IOException("Invalid JSON5 in " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses JSON5 content into a map.
     *
     * @param reader Content reader.
     * @return Map of String, Object, empty if content is empty.
     */
    public static Map<String, Object> parse(Reader reader) {
        JsonReader jsonReader = new JsonReader(reader);
        jsonReader.setLenient(true);
        Map<String, Object> map = new Gson().fromJson(jsonReader, MAP_TYPE);
        return map != null ? map : new HashMap<>();
    }
}
