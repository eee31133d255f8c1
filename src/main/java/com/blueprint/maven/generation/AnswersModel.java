package com.blueprint.maven.generation;

import java.util.LinkedHashMap;
import java.util.Map;

import com.blueprint.maven.prompting.Answers;
import com.blueprint.maven.prompting.OptionsQuestion;
import com.blueprint.maven.prompting.Question;
import com.blueprint.maven.prompting.QuestionsList;

/**
 * Builds the rendering context of a template from its answers.
 * <p>
 * Every answer is exposed under its question name in printed form. Options
 * questions also expose the chosen label as {@code <name>Label}, confirmations
 * their boolean as {@code <name>Flag} for use in sections. With a model name the
 * same entries are also reachable as {@code <modelName>.<key>}.
 */
public final class AnswersModel {

    public static final String LABEL_SUFFIX = "Label";
    public static final String FLAG_SUFFIX = "Flag";

    public static Map<String, Object> of(QuestionsList questions, Answers answers, String modelName) {
        Map<String, Object> entries = new LinkedHashMap<>();
        for (Question<?> question : questions) {
            if (!answers.contains(question.getName())) {
                continue;
            }
            Object value = answers.get(question.getName());
            entries.put(question.getName(), question.printAnswer(value));

            switch (question.getKind()) {
                case PLAIN -> {
                }
                case OPTIONS -> entries.put(question.getName() + LABEL_SUFFIX,
                        ((OptionsQuestion) question).getOption((Integer) value));
                case CONFIRMATION -> entries.put(question.getName() + FLAG_SUFFIX, value);
            }
        }

        Map<String, Object> model = new LinkedHashMap<>(entries);
        if (modelName != null && !modelName.isBlank()) {
            model.put(modelName, entries);
        }
        return model;
    }

    private AnswersModel() {
    }
}
