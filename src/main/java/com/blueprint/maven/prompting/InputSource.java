package com.blueprint.maven.prompting;

import java.io.IOException;

/**
 * Source of raw answers.
 */
public interface InputSource {

    /**
     * Reads the raw answer to the given question.
     *
     * @return the text typed, or null when no more input is available
     * @throws IOException if reading fails
     */
    String readLine(Question<?> question) throws IOException;
}
