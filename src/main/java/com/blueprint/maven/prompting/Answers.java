package com.blueprint.maven.prompting;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Answers collected during a prompting session, keyed by question name.
 * <p>
 * Iteration order is the order in which the questions were answered. A key can
 * be set only once; answers grow monotonically until the session ends.
 */
public class Answers {

    private final Map<String, Object> values = new LinkedHashMap<>();

    public static Answers empty() {
        return new Answers();
    }

    /**
     * Creates answers pre-filled with the given values, in the map's iteration order.
     */
    public static Answers of(Map<String, ?> values) {
        Answers answers = new Answers();
        values.forEach(answers::put);
        return answers;
    }

    /**
     * Commits an answer.
     *
     * @throws IllegalStateException if the question was already answered
     */
    public void put(String name, Object value) {
        if (name == null || value == null) {
            throw new IllegalArgumentException("Answer name and value are required");
        }
        if (values.containsKey(name)) {
            throw new IllegalStateException("Question " + name + " is already answered");
        }
        values.put(name, value);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * Returns the answer for the given question.
     *
     * @throws IllegalStateException if the question has not been answered yet
     */
    public Object get(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalStateException("No answer for question " + name);
        }
        return value;
    }

    public String getString(String name) {
        return get(name, String.class);
    }

    public int getInt(String name) {
        return get(name, Integer.class);
    }

    public boolean getBoolean(String name) {
        return get(name, Boolean.class);
    }

    public <T> T get(String name, Class<T> type) {
        Object value = get(name);
        if (!type.isInstance(value)) {
            throw new IllegalStateException("Answer " + name + " is a " + value.getClass().getSimpleName()
                    + ", not a " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public int size() {
        return values.size();
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
