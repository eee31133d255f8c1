package com.blueprint.maven.template;

import java.io.IOException;
import java.util.Map;

/**
 * Interface for template rendering engines.
 */
public interface TemplateEngine {
    /**
     * Renders a template file of the current template with the given context.
     *
     * @param templatePath path of the template file, relative to the template directory
     * @param context the context data for rendering
     * @return the rendered content
     * @throws IOException if template cannot be loaded or rendered
     */
    String render(String templatePath, Map<String, Object> context) throws IOException;

    /**
     * Renders template text that is already in memory, such as a destination path.
     *
     * @param name name used in error messages
     * @param content the template text
     * @param context the context data for rendering
     * @return the rendered content
     */
    String renderString(String name, String content, Map<String, Object> context) throws IOException;
}
