package com.blueprint.maven.prompting;

/**
 * Raw input could not be converted to the question's value type.
 */
public class ReadException extends Exception {

    public ReadException() {
        this("Invalid value");
    }

    public ReadException(String message) {
        super(message);
    }

    public ReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
