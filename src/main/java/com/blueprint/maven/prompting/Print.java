package com.blueprint.maven.prompting;

/**
 * Renders a typed value back in the form a user would type it.
 */
public interface Print<T> {

    default String print(T value) {
        return String.valueOf(value);
    }
}
