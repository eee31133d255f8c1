package com.blueprint.maven;

import java.io.IOException;
import java.util.Map;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;

import com.blueprint.maven.generation.Template;
import com.blueprint.maven.generation.TemplateException;
import com.blueprint.maven.prompting.PromptingException;

/**
 * Generates files from a template into the output directory, asking the questions
 * the template declares.
 * <p>
 * When run inside a Maven project, the project is available to the template as
 * {@code pom}, e.g. {@code {{pom.groupId}}}.
 * <p>
 * Run: {@code mvn blueprint:generate -Dblueprint.template=entity}
 */
@Mojo(name = "generate", requiresProject = false)
public class GenerateMojo extends AbstractBlueprintMojo {

    public static final String POM_MODEL = "pom";

    @Parameter(defaultValue = "${project}", readonly = true)
    private MavenProject project;

    @Parameter(property = "blueprint.template", required = true)
    private String template;

    @Override
    public void execute() throws MojoExecutionException {
        if (template == null || template.isBlank()) {
            throw new MojoExecutionException("No template configured. Use -Dblueprint.template=<name>");
        }

        try {
            Template parsed = parseTemplate(template);
            // Standalone runs have no project
            Map<String, Object> extraModel = project == null ? Map.of() : Map.of(POM_MODEL, project);
            generate(parsed, createPrompter(), extraModel, getOutputDir());
        } catch (TemplateException | IOException | PromptingException | IllegalStateException e) {
            throw failure("Failed to generate template " + template, e);
        }
    }
}
