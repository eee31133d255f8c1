package com.blueprint.maven.generation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.maven.plugin.logging.Log;

/**
 * Finds the directory of a template by name.
 * Resolution order: user templates -> default templates
 */
public class TemplateLocator {

    public static final String DESCRIPTOR_NAME = "template.xml";

    private final Path userTemplatesDir;
    private final Path defaultTemplatesDir;
    private final Log log;

    public TemplateLocator(Path userTemplatesDir, Path defaultTemplatesDir, Log log) {
        this.userTemplatesDir = userTemplatesDir;
        this.defaultTemplatesDir = defaultTemplatesDir;
        this.log = log;
    }

    /**
     * Returns the directory of the named template, the first candidate that contains a {@value #DESCRIPTOR_NAME}.
     *
     * @throws TemplateException if no candidate directory contains a description
     */
    public Path locate(String templateName) throws TemplateException {
        if (templateName == null || templateName.isBlank()) {
            throw new TemplateException("Template name is required");
        }

        List<Path> checked = new ArrayList<>();
        for (Path templatesDir : candidates()) {
            Path root = templatesDir.toAbsolutePath().normalize();
            Path templateDir = root.resolve(templateName).normalize();
            if (!templateDir.startsWith(root)) {
                throw new TemplateException("Invalid template name " + templateName);
            }
            checked.add(templateDir);
            if (Files.isRegularFile(templateDir.resolve(DESCRIPTOR_NAME))) {
                log.debug("Using template " + templateName + " from " + templateDir);
                return templateDir;
            }
        }

        throw new TemplateException("Unable to find " + DESCRIPTOR_NAME + " for template " + templateName
                + " (checked: " + checked + ")");
    }

    private List<Path> candidates() {
        List<Path> candidates = new ArrayList<>();
        if (userTemplatesDir != null) {
            candidates.add(userTemplatesDir);
        }
        if (defaultTemplatesDir != null) {
            candidates.add(defaultTemplatesDir);
        }
        return candidates;
    }
}
