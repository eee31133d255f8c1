package com.blueprint.maven.prompting;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;

/**
 * Reads answers line by line from a stream, usually {@code System.in}.
 */
public class ConsoleInputSource implements InputSource {

    private final BufferedReader reader;

    public ConsoleInputSource(InputStream in) {
        this(in, Charset.defaultCharset());
    }

    public ConsoleInputSource(InputStream in, Charset charset) {
        this.reader = new BufferedReader(new InputStreamReader(in, charset));
    }

    @Override
    public String readLine(Question<?> question) throws IOException {
        return reader.readLine();
    }
}
