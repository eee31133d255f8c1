package com.blueprint.maven.generation;

/**
 * A template could not be found or its description is invalid.
 */
public class TemplateException extends Exception {

    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
