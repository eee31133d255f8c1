package com.blueprint.maven.prompting;

/**
 * A question whose validator can be replaced once.
 */
public interface WithValidation<T> {

    /**
     * Replaces the default validator.
     *
     * @throws IllegalStateException if a validator was already set
     */
    void validate(Validator<T> validator);
}
