package com.blueprint.maven.generation;

import java.nio.file.Path;
import java.util.List;

/**
 * A parsed template: where it lives, the name its answers are exposed under,
 * its questions and its generation instructions.
 */
public class Template {

    private final Path path;
    private final String modelName;
    private final List<TemplateQuestion> questions;
    private final List<GenerationInstruction> instructions;

    public Template(Path path, String modelName, List<TemplateQuestion> questions,
            List<GenerationInstruction> instructions) {
        this.path = path;
        this.modelName = modelName == null ? "" : modelName;
        this.questions = List.copyOf(questions);
        this.instructions = List.copyOf(instructions);
    }

    public Path getPath() {
        return path;
    }

    public String getModelName() {
        return modelName;
    }

    public List<TemplateQuestion> getQuestions() {
        return questions;
    }

    public List<GenerationInstruction> getInstructions() {
        return instructions;
    }
}
