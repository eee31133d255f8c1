package com.blueprint.maven.prompting;

/**
 * A question could not be answered: input ended, or an answer was rejected in batch mode.
 */
public class PromptingException extends RuntimeException {

    public PromptingException(String message) {
        super(message);
    }
}
