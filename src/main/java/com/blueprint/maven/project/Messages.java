package com.blueprint.maven.project;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Localized messages: plain strings and string lists, looked up by key.
 */
public class Messages {

    private final Map<String, Object> entries;

    public Messages(Map<String, Object> entries) {
        this.entries = entries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * @throws IllegalArgumentException if there is no message with this key
     */
    public String get(String key) {
        Object value = lookup(key);
        if (value instanceof List) {
            return ((List<?>) value).stream().map(String::valueOf).collect(Collectors.joining(","));
        }
        return String.valueOf(value);
    }

    /**
     * Returns a list message. A YAML sequence is returned element by element, a plain
     * string is split at commas.
     *
     * @throws IllegalArgumentException if there is no message with this key
     */
    public List<String> getList(String key) {
        Object value = lookup(key);
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                result.add(String.valueOf(item).trim());
            }
        } else {
            Arrays.stream(String.valueOf(value).split(","))
                    .map(String::trim)
                    .filter(item -> !item.isEmpty())
                    .forEach(result::add);
        }
        return List.copyOf(result);
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    private Object lookup(String key) {
        Object value = entries.get(key);
        if (value == null) {
            throw new IllegalArgumentException("No message for key " + key);
        }
        return value;
    }
}
