package com.blueprint.maven.template;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheException;
import com.github.mustachejava.MustacheFactory;

/**
 * Mustache-based template engine implementation.
 * <p>
 * Generated files are source code, not HTML, so values are written without escaping.
 * Partials ({@code {{> header.txt}}}) are loaded through the {@link TemplateLoader},
 * relative to the including source and never from outside the template directory.
 */
public class MustacheTemplateEngine implements TemplateEngine {
    private final TemplateLoader templateLoader;
    private final MustacheFactory mustacheFactory;

    public MustacheTemplateEngine(TemplateLoader templateLoader) {
        this.templateLoader = templateLoader;
        this.mustacheFactory = new DefaultMustacheFactory() {
            @Override
            public void encode(String value, Writer writer) {
                try {
                    writer.write(value);
                } catch (IOException e) {
                    throw new MustacheException("Failed to write value", e);
                }
            }

            @Override
            public Reader getReader(String resourceName) {
                try {
                    return Files.newBufferedReader(templateLoader.resolve(resourceName), StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new MustacheException("Failed to load partial " + resourceName + ": " + e.getMessage(), e);
                }
            }
        };
    }

    @Override
    public String render(String templatePath, Map<String, Object> context) throws IOException {
        String templateContent = templateLoader.loadTemplate(templatePath);
        return renderString(templatePath, templateContent, context);
    }

    @Override
    public String renderString(String name, String content, Map<String, Object> context) throws IOException {
        try {
            Mustache mustache = mustacheFactory.compile(new StringReader(content), name);
            StringWriter writer = new StringWriter();
            mustache.execute(writer, context).flush();
            return writer.toString();
        } catch (MustacheException e) {
            throw new IOException("Failed to render template " + name + ": " + e.getMessage(), e);
        }
    }
}
