package com.blueprint.maven.template;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.maven.plugin.logging.Log;

/**
 * Loads the source files of a template from its directory.
 * Paths are relative to the template directory and may not leave it.
 */
public class TemplateLoader {
    private final Path templateDir;
    private final Log log;

    public TemplateLoader(Path templateDir, Log log) {
        this.templateDir = templateDir.toAbsolutePath().normalize();
        this.log = log;
    }

    /**
     * Resolves a template source file.
     *
     * @param templatePath relative path to the source (e.g., "src/Entity.java")
     * @return absolute path of an existing file
     * @throws IOException if the file does not exist or lies outside the template directory
     */
    public Path resolve(String templatePath) throws IOException {
        Path source = templateDir.resolve(templatePath).normalize();
        if (!source.startsWith(templateDir)) {
            throw new IOException("Template source " + templatePath + " is outside of " + templateDir);
        }
        if (!Files.isRegularFile(source)) {
            throw new IOException("Template source not found: " + templatePath + " (checked: " + source + ")");
        }
        return source;
    }

    /**
     * Loads a template source as UTF-8 text.
     */
    public String loadTemplate(String templatePath) throws IOException {
        Path source = resolve(templatePath);
        log.debug("Using template source: " + source);
        return Files.readString(source, StandardCharsets.UTF_8);
    }
}
