package com.blueprint.maven.generation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.maven.plugin.logging.Log;

import com.blueprint.maven.prompting.Answers;
import com.blueprint.maven.prompting.QuestionsList;
import com.blueprint.maven.template.MustacheTemplateEngine;
import com.blueprint.maven.template.TemplateEngine;
import com.blueprint.maven.template.TemplateLoader;

/**
 * Executes the generation instructions of a template into a target directory.
 * <p>
 * Instructions run one after another in declaration order; later instructions may
 * rely on files written by earlier ones. The first failure stops the run and files
 * already written are left in place.
 */
public class GenerationExecutor {

    private final TemplateLoader templateLoader;
    private final TemplateEngine templateEngine;
    private final Path targetDir;
    private final Log log;

    public GenerationExecutor(Path templateDir, Path targetDir, Log log) {
        this(new TemplateLoader(templateDir, log), targetDir, log);
    }

    private GenerationExecutor(TemplateLoader templateLoader, Path targetDir, Log log) {
        this(templateLoader, new MustacheTemplateEngine(templateLoader), targetDir, log);
    }

    public GenerationExecutor(TemplateLoader templateLoader, TemplateEngine templateEngine, Path targetDir,
            Log log) {
        this.templateLoader = templateLoader;
        this.templateEngine = templateEngine;
        this.targetDir = targetDir.toAbsolutePath().normalize();
        this.log = log;
    }

    /**
     * Generates a template with the answers to its questions.
     */
    public List<Path> execute(Template template, QuestionsList questions, Answers answers) throws IOException {
        return execute(template.getInstructions(), AnswersModel.of(questions, answers, template.getModelName()));
    }

    /**
     * Executes instructions in order.
     *
     * @param model rendering context for transformed sources and destination paths
     * @return the files written, in instruction order
     * @throws IOException on the first instruction that fails; remaining instructions are skipped
     */
    public List<Path> execute(List<GenerationInstruction> instructions, Map<String, Object> model)
            throws IOException {
        List<Path> written = new ArrayList<>();
        for (GenerationInstruction instruction : instructions) {
            written.add(apply(instruction, model));
        }
        return written;
    }

    private Path apply(GenerationInstruction instruction, Map<String, Object> model) throws IOException {
        Path destination = resolveDestination(instruction.getDestination(), model);
        Path parent = destination.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        if (instruction.isTransform()) {
            String content = templateEngine.render(instruction.getSource(), model);
            Files.writeString(destination, content, StandardCharsets.UTF_8);
            log.debug("Transformed " + instruction.getSource() + " -> " + destination);
        } else {
            Path source = templateLoader.resolve(instruction.getSource());
            Files.copy(source, destination, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Copied " + instruction.getSource() + " -> " + destination);
        }
        return destination;
    }

    private Path resolveDestination(String destination, Map<String, Object> model) throws IOException {
        String rendered = templateEngine.renderString(destination, destination, model);
        Path path = targetDir.resolve(rendered).normalize();
        if (!path.startsWith(targetDir)) {
            throw new IOException("Destination " + rendered + " is outside of " + targetDir);
        }
        return path;
    }
}
