package com.blueprint.maven.prompting;

import java.util.function.Function;

/**
 * A question whose default value can be configured. The default may be reassigned any number of times.
 */
public interface HasDefault<T> {

    DefaultValue<T> getDefaultValue();

    void setDefaultValue(DefaultValue<T> defaultValue);

    default void setDefault(T value) {
        setDefaultValue(DefaultValue.plain(value));
    }

    /**
     * Sets a default calculated from the answers given before this question is asked.
     */
    default void calculateDefault(Function<Answers, T> function) {
        setDefaultValue(DefaultValue.calculated(function));
    }
}
