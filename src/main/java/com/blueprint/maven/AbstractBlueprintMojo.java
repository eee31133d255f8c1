package com.blueprint.maven;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Parameter;

import com.blueprint.maven.generation.AnswersModel;
import com.blueprint.maven.generation.GenerationExecutor;
import com.blueprint.maven.generation.Template;
import com.blueprint.maven.generation.TemplateException;
import com.blueprint.maven.generation.TemplateLocator;
import com.blueprint.maven.generation.TemplateParser;
import com.blueprint.maven.generation.TemplateQuestions;
import com.blueprint.maven.prompting.Answers;
import com.blueprint.maven.prompting.ConsoleInputSource;
import com.blueprint.maven.prompting.PresetInputSource;
import com.blueprint.maven.prompting.Prompter;
import com.blueprint.maven.prompting.PromptingException;
import com.blueprint.maven.prompting.Question;
import com.blueprint.maven.prompting.QuestionsList;

/**
 * Shared configuration of the Blueprint goals: where templates are found, where output
 * goes, and how questions are answered.
 */
public abstract class AbstractBlueprintMojo extends AbstractMojo {

    @Parameter(property = "blueprint.templatesDir", defaultValue = "${user.home}/.blueprint/templates")
    private File templatesDir;

    @Parameter(property = "blueprint.defaultTemplatesDir")
    private File defaultTemplatesDir;

    @Parameter(property = "blueprint.outputDir", defaultValue = "${basedir}")
    private File outputDir;

    /**
     * Ask questions on the console. When false, answers come from {@link #answers}
     * and unanswered questions take their defaults.
     */
    @Parameter(property = "blueprint.interactiveMode", defaultValue = "${settings.interactiveMode}")
    private boolean interactiveMode;

    /**
     * Raw answers keyed by question name, used in batch mode.
     */
    @Parameter
    private Map<String, String> answers;

    @Parameter(property = "blueprint.locale")
    private String locale;

    protected Path getOutputDir() {
        return outputDir == null ? Path.of(".") : outputDir.toPath();
    }

    protected Locale getLocale() {
        return locale == null || locale.isBlank() ? Locale.getDefault() : Locale.forLanguageTag(locale);
    }

    protected Prompter createPrompter() {
        if (interactiveMode) {
            return new Prompter(new ConsoleInputSource(System.in), System.out, true);
        }
        return new Prompter(new PresetInputSource(answers), System.out, false);
    }

    protected Template parseTemplate(String templateName) throws TemplateException {
        TemplateLocator locator = new TemplateLocator(
                templatesDir == null ? null : templatesDir.toPath(),
                defaultTemplatesDir == null ? null : defaultTemplatesDir.toPath(),
                getLog());
        return new TemplateParser(locator).parse(templateName);
    }

    /**
     * Asks the questions of a template and generates it into {@code targetDir}.
     *
     * @param template the parsed template
     * @param prompter answers the template's questions
     * @param extraModel entries added to the rendering context next to the answers
     * @param targetDir directory the template's destinations are relative to
     * @return the files written
     * @throws TemplateException if the template's model name or a question name is one of the keys of
     *         {@code extraModel}
     */
    protected List<Path> generate(Template template, Prompter prompter, Map<String, Object> extraModel,
            Path targetDir) throws IOException, TemplateException {
        Optional<QuestionsList> questions = TemplateQuestions.toQuestionsList(template);

        Map<String, Object> model = new LinkedHashMap<>();
        if (questions.isPresent()) {
            checkReservedNames(template, questions.get(), extraModel);
            Answers templateAnswers = prompter.ask(questions.get());
            model.putAll(AnswersModel.of(questions.get(), templateAnswers, template.getModelName()));
        }
        model.putAll(extraModel);

        getLog().info("Blueprint: Generating " + template.getPath().getFileName() + " into " + targetDir);
        List<Path> written = new GenerationExecutor(template.getPath(), targetDir, getLog())
                .execute(template.getInstructions(), model);
        getLog().info("Blueprint: Wrote " + written.size() + " file(s)");
        return written;
    }

    private static void checkReservedNames(Template template, QuestionsList questions,
            Map<String, Object> extraModel) throws TemplateException {
        String templateName = String.valueOf(template.getPath().getFileName());
        if (extraModel.containsKey(template.getModelName())) {
            throw new TemplateException("Invalid template " + templateName + ": model name "
                    + template.getModelName() + " is reserved");
        }
        for (Question<?> question : questions) {
            for (String key : List.of(question.getName(),
                    question.getName() + AnswersModel.LABEL_SUFFIX,
                    question.getName() + AnswersModel.FLAG_SUFFIX)) {
                if (extraModel.containsKey(key)) {
                    throw new TemplateException("Invalid template " + templateName + ": question "
                            + question.getName() + " uses reserved name " + key);
                }
            }
        }
    }

    /**
     * Wraps a failure into the exception reported to Maven.
     */
    protected MojoExecutionException failure(String message, Exception cause) {
        if (cause instanceof TemplateException || cause instanceof PromptingException
                || cause instanceof IllegalStateException) {
            return new MojoExecutionException(message + ": " + cause.getMessage(), cause);
        }
        return new MojoExecutionException(message, cause);
    }
}
