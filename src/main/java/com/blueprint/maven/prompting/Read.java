package com.blueprint.maven.prompting;

/**
 * Converts raw user input into a typed value.
 */
public interface Read<T> {

    /**
     * @param raw text typed by the user, never null
     * @return the converted value
     * @throws ReadException if the text cannot be converted; its message is shown to the user
     */
    T read(String raw) throws ReadException;
}
