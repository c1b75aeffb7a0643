package com.cfoPilot.aiCfo.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Utility class for loading JSON seed files from the classpath.
 * Seed files hold an array of records; unknown properties are ignored so fixtures can carry notes.
 */
public class JsonFileLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonFileLoader.class);
    private static final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private JsonFileLoader() {}

    /**
     * Loads a classpath resource as a UTF-8 string.
     *
     * @param resourcePath The path to the JSON file (e.g., "data/models.json")
     * @return The JSON content
     * @throws IOException if the file cannot be read or doesn't exist
     */
    public static String loadAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = JsonFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Loads a JSON array from the classpath into a list of the given type.
     *
     * @param resourcePath The path to the JSON file containing a JSON array
     * @param clazz The element type
     * @param <T> The type of objects in the list
     * @return A list of deserialized records
     * @throws IOException if the file cannot be read or cannot be deserialized
     */
    public static <T> List<T> loadAsList(String resourcePath, Class<T> clazz) throws IOException {
        String jsonString = loadAsString(resourcePath);
        return objectMapper.readValue(jsonString,
                objectMapper.getTypeFactory().constructCollectionType(List.class, clazz));
    }

    /**
     * Same as {@link #loadAsList(String, Class)} but returns an empty list when the resource is
     * missing or malformed. Seed data is optional.
     */
    public static <T> List<T> loadAsListOrEmpty(String resourcePath, Class<T> clazz) {
        try {
            return loadAsList(resourcePath, clazz);
        } catch (IOException e) {
            log.warn("Failed to load JSON seed from classpath: {} ({})", resourcePath, e.getMessage());
            return List.of();
        }
    }
}
