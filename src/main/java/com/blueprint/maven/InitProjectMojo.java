package com.blueprint.maven;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Stream;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import com.blueprint.maven.generation.Template;
import com.blueprint.maven.generation.TemplateException;
import com.blueprint.maven.project.Messages;
import com.blueprint.maven.project.MessagesLoader;
import com.blueprint.maven.project.ProjectInitModel;
import com.blueprint.maven.project.ProjectInitQuestions;
import com.blueprint.maven.prompting.Answers;
import com.blueprint.maven.prompting.Prompter;
import com.blueprint.maven.prompting.PromptingException;

/**
 * Creates a new project: asks for its name, package, platform version and database,
 * then generates the project template into {@code <outputDir>/<projectName>}.
 * <p>
 * The project model is available to the template as {@code project}, e.g.
 * {@code {{project.rootPackage}}} or {@code {{project.database.driver}}}.
 * <p>
 * Run: {@code mvn blueprint:init}
 */
@Mojo(name = "init", requiresProject = false)
public class InitProjectMojo extends AbstractBlueprintMojo {

    public static final String PROJECT_MODEL = "project";

    @Parameter(property = "blueprint.template", defaultValue = "project")
    private String template;

    @Parameter(property = "blueprint.forceOverwrite", defaultValue = "false")
    private boolean forceOverwrite;

    @Override
    public void execute() throws MojoExecutionException {
        getLog().info("Blueprint: Creating a new project from template " + template);

        try {
            // Parse first so a broken template fails before any question is asked
            Template parsed = parseTemplate(template);
            Messages messages = MessagesLoader.load(getLocale());
            Prompter prompter = createPrompter();

            Answers answers = prompter.ask(ProjectInitQuestions.create(messages));
            ProjectInitModel model = new ProjectInitModel(answers, messages);

            Path projectDir = getOutputDir().resolve(model.getProjectName());
            if (!forceOverwrite && isNonEmptyDirectory(projectDir)) {
                throw new MojoExecutionException("Directory " + projectDir + " already exists and is not empty."
                        + "\nUse -Dblueprint.forceOverwrite=true to generate into it anyway.");
            }

            generate(parsed, prompter, Map.of(PROJECT_MODEL, model), projectDir);
        } catch (TemplateException | IOException | PromptingException | IllegalStateException e) {
            throw failure("Failed to create project", e);
        }
    }

    private static boolean isNonEmptyDirectory(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return false;
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isPresent();
        }
    }
}
