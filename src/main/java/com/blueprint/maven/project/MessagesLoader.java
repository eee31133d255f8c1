package com.blueprint.maven.project;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.yaml.snakeyaml.Yaml;

/**
 * Loads messages from YAML resources.
 * <p>
 * {@code <base>.yml} holds every message, {@code <base>_<language>.yml} may override
 * any of them for a locale.
 */
public class MessagesLoader {

    public static final String DEFAULT_BASE_NAME = "/blueprint/messages";

    private static final Yaml yaml = new Yaml();

    /**
     * Loads the plugin's messages for a locale.
     */
    public static Messages load(Locale locale) throws IOException {
        return load(DEFAULT_BASE_NAME, locale);
    }

    public static Messages load(String baseName, Locale locale) throws IOException {
        Map<String, Object> entries = new LinkedHashMap<>(loadFromResource(baseName + ".yml", true));
        if (locale != null && !locale.getLanguage().isEmpty()) {
            entries.putAll(loadFromResource(baseName + "_" + locale.getLanguage() + ".yml", false));
        }
        return new Messages(entries);
    }

    private static Map<String, Object> loadFromResource(String resourcePath, boolean required) throws IOException {
        try (InputStream inputStream = MessagesLoader.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                if (required) {
                    throw new IOException("Resource not found: " + resourcePath);
                }
                return Map.of();
            }
            Map<String, Object> data = yaml.load(inputStream);
            return data == null ? Map.of() : data;
        }
    }
}
